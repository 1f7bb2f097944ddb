package com.cellparser.ast;

public record Identifier(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name
) implements Expression, Pattern, CellName {

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public Kind kind() {
        return Kind.PLAIN;
    }

    @Override
    public Identifier identifier() {
        return this;
    }
}
