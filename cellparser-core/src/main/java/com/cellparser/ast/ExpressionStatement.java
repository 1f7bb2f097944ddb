package com.cellparser.ast;

public record ExpressionStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression expression,
    String directive  // raw directive text for prologue strings, else null
) implements Statement {

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
