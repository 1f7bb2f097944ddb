package com.cellparser.ast;

public record ConditionalExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {

    @Override
    public String type() {
        return "ConditionalExpression";
    }
}
