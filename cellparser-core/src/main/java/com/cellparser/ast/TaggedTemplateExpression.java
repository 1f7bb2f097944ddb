package com.cellparser.ast;

public record TaggedTemplateExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression tag,
    TemplateLiteral quasi
) implements Expression {

    @Override
    public String type() {
        return "TaggedTemplateExpression";
    }
}
