package com.cellparser.ast;

import java.util.List;

public record ClassBody(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<MethodDefinition> body
) implements Node {

    @Override
    public String type() {
        return "ClassBody";
    }
}
