package com.cellparser.ast;

/**
 * The declared name of a cell: a plain identifier, or an identifier wrapped
 * by the {@code viewof} or {@code mutable} modifier.
 */
public sealed interface CellName extends Node permits Identifier, ViewExpression, MutableExpression {

    enum Kind {
        PLAIN,
        VIEW,
        MUTABLE
    }

    Kind kind();

    /**
     * The identifier being declared, unwrapped from any modifier.
     */
    Identifier identifier();

    /**
     * Whether a node of this kind may appear on the left of an assignment
     * inside a cell body. Views are read-only; mutables are assigned through
     * their setter.
     */
    default boolean assignable() {
        return switch (kind()) {
            case PLAIN, MUTABLE -> true;
            case VIEW -> false;
        };
    }
}
