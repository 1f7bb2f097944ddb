package com.cellparser.ast;

public record LabeledStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier label,
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "LabeledStatement";
    }
}
