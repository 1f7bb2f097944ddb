package com.cellparser.ast;

public record AwaitExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression argument
) implements Expression {

    @Override
    public String type() {
        return "AwaitExpression";
    }
}
