package com.cellparser.ast;

public record ClassExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,
    Expression superClass,
    ClassBody body
) implements Expression {

    @Override
    public String type() {
        return "ClassExpression";
    }
}
