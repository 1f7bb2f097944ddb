package com.cellparser.ast;

public record ThrowStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression argument
) implements Statement {

    @Override
    public String type() {
        return "ThrowStatement";
    }
}
