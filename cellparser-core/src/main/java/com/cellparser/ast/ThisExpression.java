package com.cellparser.ast;

public record ThisExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Expression {

    @Override
    public String type() {
        return "ThisExpression";
    }
}
