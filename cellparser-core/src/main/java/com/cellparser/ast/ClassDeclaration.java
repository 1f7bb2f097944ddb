package com.cellparser.ast;

public record ClassDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,
    Expression superClass,
    ClassBody body
) implements Statement {

    @Override
    public String type() {
        return "ClassDeclaration";
    }
}
