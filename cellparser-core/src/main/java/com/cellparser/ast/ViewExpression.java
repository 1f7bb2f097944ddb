package com.cellparser.ast;

/**
 * {@code viewof name}: refers to the displayed input of a cell rather than
 * its value.
 */
public record ViewExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id
) implements Expression, CellName {

    @Override
    public String type() {
        return "ViewExpression";
    }

    @Override
    public Kind kind() {
        return Kind.VIEW;
    }

    @Override
    public Identifier identifier() {
        return id;
    }
}
