package com.cellparser.ast;

import java.util.List;

public record ObjectPattern(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Node> properties  // Property or RestElement
) implements Pattern {

    @Override
    public String type() {
        return "ObjectPattern";
    }
}
