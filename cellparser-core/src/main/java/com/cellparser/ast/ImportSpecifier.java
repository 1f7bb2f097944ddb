package com.cellparser.ast;

public record ImportSpecifier(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier imported,  // the name in the imported module
    Identifier local,  // the local binding name
    boolean view,
    boolean mutable
) implements Node {

    @Override
    public String type() {
        return "ImportSpecifier";
    }
}
