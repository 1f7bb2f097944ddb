package com.cellparser.ast;

public record VariableDeclarator(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Pattern id,
    Expression init
) implements Node {

    @Override
    public String type() {
        return "VariableDeclarator";
    }
}
