package com.cellparser.ast;

import java.util.List;

public record ObjectExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Node> properties  // Property or SpreadElement
) implements Expression {

    @Override
    public String type() {
        return "ObjectExpression";
    }
}
