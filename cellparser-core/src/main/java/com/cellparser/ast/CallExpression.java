package com.cellparser.ast;

import java.util.List;

public record CallExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression callee,
    List<Expression> arguments,
    boolean optional
) implements Expression {

    @Override
    public String type() {
        return "CallExpression";
    }
}
