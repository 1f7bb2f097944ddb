package com.cellparser.ast;

import java.util.List;

public record SwitchCase(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,  // null for the default clause
    List<Statement> consequent
) implements Node {

    @Override
    public String type() {
        return "SwitchCase";
    }
}
