package com.cellparser.ast;

import java.util.List;

public record NewExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression callee,
    List<Expression> arguments
) implements Expression {

    @Override
    public String type() {
        return "NewExpression";
    }
}
