package com.cellparser.ast;

import java.util.List;

public record SwitchStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression discriminant,
    List<SwitchCase> cases
) implements Statement {

    @Override
    public String type() {
        return "SwitchStatement";
    }
}
