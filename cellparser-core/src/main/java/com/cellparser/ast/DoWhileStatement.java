package com.cellparser.ast;

public record DoWhileStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Statement body,
    Expression test
) implements Statement {

    @Override
    public String type() {
        return "DoWhileStatement";
    }
}
