package com.cellparser.ast;

public record UpdateExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,
    boolean prefix,
    Expression argument
) implements Expression {

    @Override
    public String type() {
        return "UpdateExpression";
    }
}
