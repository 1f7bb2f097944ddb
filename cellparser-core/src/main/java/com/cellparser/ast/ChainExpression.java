package com.cellparser.ast;

public record ChainExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression expression
) implements Expression {

    @Override
    public String type() {
        return "ChainExpression";
    }
}
