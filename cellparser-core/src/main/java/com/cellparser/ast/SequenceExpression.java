package com.cellparser.ast;

import java.util.List;

public record SequenceExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Expression> expressions
) implements Expression {

    @Override
    public String type() {
        return "SequenceExpression";
    }
}
