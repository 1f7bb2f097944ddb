package com.cellparser.ast;

public record Property(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Node key,
    Node value,
    String kind,
    boolean method,
    boolean shorthand,
    boolean computed
) implements Node {

    @Override
    public String type() {
        return "Property";
    }
}
