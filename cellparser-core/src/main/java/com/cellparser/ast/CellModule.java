package com.cellparser.ast;

import java.util.List;

/**
 * The cells of one source text, in source order.
 */
public record CellModule(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Cell> cells
) implements Node {

    @Override
    public String type() {
        return "Program";
    }
}
