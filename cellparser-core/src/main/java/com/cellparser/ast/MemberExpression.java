package com.cellparser.ast;

public record MemberExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression object,
    Expression property,
    boolean computed,
    boolean optional
) implements Expression, Pattern {

    @Override
    public String type() {
        return "MemberExpression";
    }
}
