package com.cellparser.ast;

import java.util.List;

public record BlockStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Statement> body
) implements Statement {

    @Override
    public String type() {
        return "BlockStatement";
    }
}
