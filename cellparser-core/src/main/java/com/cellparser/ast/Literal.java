package com.cellparser.ast;

public record Literal(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Object value,
    String raw,
    RegexInfo regex,
    String bigint  // decimal digits of a BigInt literal, else null
) implements Expression {

    @Override
    public String type() {
        return "Literal";
    }

    public record RegexInfo(String pattern, String flags) {}
}
