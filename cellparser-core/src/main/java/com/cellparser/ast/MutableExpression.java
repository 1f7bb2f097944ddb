package com.cellparser.ast;

/**
 * {@code mutable name}: a cell value that later cells may reassign.
 * Valid wherever an assignment target is expected.
 */
public record MutableExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id
) implements Expression, Pattern, CellName {

    @Override
    public String type() {
        return "MutableExpression";
    }

    @Override
    public Kind kind() {
        return Kind.MUTABLE;
    }

    @Override
    public Identifier identifier() {
        return id;
    }
}
