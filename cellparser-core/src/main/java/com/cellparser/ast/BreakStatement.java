package com.cellparser.ast;

public record BreakStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier label
) implements Statement {

    @Override
    public String type() {
        return "BreakStatement";
    }
}
