package com.cellparser.ast;

public record YieldExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    boolean delegate,
    Expression argument
) implements Expression {

    @Override
    public String type() {
        return "YieldExpression";
    }
}
