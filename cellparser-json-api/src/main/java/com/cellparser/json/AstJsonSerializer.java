package com.cellparser.json;

import com.cellparser.ast.Node;

/**
 * Renders AST nodes as ESTree-style JSON. Cells and cell modules are nodes
 * too and serialize the same way.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node to compact JSON.
     *
     * @param node the node to serialize
     * @return the JSON text
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a node to indented JSON.
     *
     * @param node the node to serialize
     * @return the JSON text
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
