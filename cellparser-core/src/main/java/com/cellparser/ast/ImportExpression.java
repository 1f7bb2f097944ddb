package com.cellparser.ast;

public record ImportExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression source
) implements Expression {

    @Override
    public String type() {
        return "ImportExpression";
    }
}
