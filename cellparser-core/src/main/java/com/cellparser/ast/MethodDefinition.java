package com.cellparser.ast;

public record MethodDefinition(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression key,
    FunctionExpression value,
    String kind,  // constructor, method, get or set
    boolean computed,
    boolean isStatic
) implements Node {

    @Override
    public String type() {
        return "MethodDefinition";
    }
}
