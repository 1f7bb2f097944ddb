package com.cellparser.ast;

public record WithStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression object,
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "WithStatement";
    }
}
