package com.cellparser.ast;

import java.util.List;

public record TemplateLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<TemplateElement> quasis,
    List<Expression> expressions
) implements Expression {

    @Override
    public String type() {
        return "TemplateLiteral";
    }
}
