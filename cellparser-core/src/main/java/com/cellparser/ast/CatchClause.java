package com.cellparser.ast;

public record CatchClause(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Pattern param,  // null for optional catch binding
    BlockStatement body
) implements Node {

    @Override
    public String type() {
        return "CatchClause";
    }
}
