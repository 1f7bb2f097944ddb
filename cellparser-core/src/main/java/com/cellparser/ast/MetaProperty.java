package com.cellparser.ast;

public record MetaProperty(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier meta,
    Identifier property
) implements Expression {

    @Override
    public String type() {
        return "MetaProperty";
    }
}
