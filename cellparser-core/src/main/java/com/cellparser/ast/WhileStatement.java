package com.cellparser.ast;

public record WhileStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "WhileStatement";
    }
}
