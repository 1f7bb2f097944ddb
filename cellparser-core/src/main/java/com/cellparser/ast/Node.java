package com.cellparser.ast;

/**
 * Base interface for all ESTree AST nodes, plus the cell-level nodes
 * ({@link Cell}, {@link CellModule}) built on top of them.
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    Pattern,
    CellName,
    TemplateElement,
    Property,
    ClassBody,
    MethodDefinition,
    CatchClause,
    SwitchCase,
    VariableDeclarator,
    ImportSpecifier,
    Cell,
    CellModule {

    String type();
    int start();
    int end();
    int startLine();
    int startCol();
    int endLine();
    int endCol();

    default SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine(), startCol()),
            new SourceLocation.Position(endLine(), endCol())
        );
    }
}
