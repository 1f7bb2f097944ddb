package com.cellparser.ast;

import java.util.List;

public record ArrayPattern(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Pattern> elements  // null entries are holes
) implements Pattern {

    @Override
    public String type() {
        return "ArrayPattern";
    }
}
