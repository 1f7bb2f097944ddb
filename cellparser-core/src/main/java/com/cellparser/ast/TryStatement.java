package com.cellparser.ast;

public record TryStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    BlockStatement block,
    CatchClause handler,
    BlockStatement finalizer
) implements Statement {

    @Override
    public String type() {
        return "TryStatement";
    }
}
