package com.cellparser.ast;

public record BinaryExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,
    Expression left,
    Expression right
) implements Expression {

    @Override
    public String type() {
        return "BinaryExpression";
    }
}
