package com.cellparser.ast;

public record ForOfStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Node left,  // VariableDeclaration or Pattern
    Expression right,
    Statement body,
    boolean await
) implements Statement {

    @Override
    public String type() {
        return "ForOfStatement";
    }
}
