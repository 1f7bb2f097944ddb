package com.cellparser.ast;

public record ForStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Node init,  // VariableDeclaration, Expression or null
    Expression test,
    Expression update,
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "ForStatement";
    }
}
