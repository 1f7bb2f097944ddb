package com.cellparser.ast;

import java.util.List;

public record ImportDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<ImportSpecifier> specifiers,
    List<ImportSpecifier> injections,  // values supplied to the imported module; null without a 'with' clause
    Literal source
) implements Statement {

    @Override
    public String type() {
        return "ImportDeclaration";
    }
}
