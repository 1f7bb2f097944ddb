package com.cellparser.ast;

public record TemplateElement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    TemplateElementValue value,
    boolean tail
) implements Node {

    @Override
    public String type() {
        return "TemplateElement";
    }

    // cooked is null when the raw text holds an invalid escape (tagged templates only)
    public record TemplateElementValue(String raw, String cooked) {}
}
