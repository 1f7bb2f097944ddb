package com.cellparser.ast;

import java.util.List;

public record Program(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Statement> body,
    String sourceType
) implements Node {

    @Override
    public String type() {
        return "Program";
    }
}
