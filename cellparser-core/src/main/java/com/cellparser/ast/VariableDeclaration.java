package com.cellparser.ast;

import java.util.List;

public record VariableDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<VariableDeclarator> declarations,
    String kind
) implements Statement {

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
