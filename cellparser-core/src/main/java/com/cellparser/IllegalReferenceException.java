package com.cellparser;

import com.cellparser.ast.Node;

/**
 * A cell body that parses but refers to names in a way cells may not: it
 * uses {@code arguments} outside a function, or assigns to a name that the
 * cell does not declare.
 */
public class IllegalReferenceException extends RuntimeException {

    private final transient Node node;

    public IllegalReferenceException(String message, Node node) {
        super(message);
        this.node = node;
    }

    /**
     * The offending identifier (or viewof/mutable expression).
     */
    public Node node() {
        return node;
    }
}
