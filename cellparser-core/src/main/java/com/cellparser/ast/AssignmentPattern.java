package com.cellparser.ast;

public record AssignmentPattern(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Pattern left,
    Expression right
) implements Pattern {

    @Override
    public String type() {
        return "AssignmentPattern";
    }
}
