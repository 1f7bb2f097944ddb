package com.cellparser.ast;

import java.util.List;

public record ArrayExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Expression> elements  // null entries are holes
) implements Expression {

    @Override
    public String type() {
        return "ArrayExpression";
    }
}
