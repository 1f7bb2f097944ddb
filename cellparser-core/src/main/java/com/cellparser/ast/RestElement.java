package com.cellparser.ast;

public record RestElement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Pattern argument
) implements Pattern {

    @Override
    public String type() {
        return "RestElement";
    }
}
