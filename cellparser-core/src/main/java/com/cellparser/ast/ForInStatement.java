package com.cellparser.ast;

public record ForInStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Node left,  // VariableDeclaration or Pattern
    Expression right,
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "ForInStatement";
    }
}
