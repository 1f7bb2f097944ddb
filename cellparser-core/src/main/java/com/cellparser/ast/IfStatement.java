package com.cellparser.ast;

public record IfStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,
    Statement consequent,
    Statement alternate
) implements Statement {

    @Override
    public String type() {
        return "IfStatement";
    }
}
