package com.cellparser.ast;

public record DebuggerStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Statement {

    @Override
    public String type() {
        return "DebuggerStatement";
    }
}
