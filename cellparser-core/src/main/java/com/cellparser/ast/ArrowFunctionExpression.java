package com.cellparser.ast;

import java.util.List;

public record ArrowFunctionExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,
    boolean expression,  // true when the body is a bare expression
    boolean generator,
    boolean async,
    List<Pattern> params,
    Node body  // BlockStatement or Expression
) implements Expression {

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }
}
