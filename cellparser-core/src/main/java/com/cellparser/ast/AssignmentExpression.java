package com.cellparser.ast;

public record AssignmentExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,
    Pattern left,
    Expression right
) implements Expression {

    @Override
    public String type() {
        return "AssignmentExpression";
    }
}
