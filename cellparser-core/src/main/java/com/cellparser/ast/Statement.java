package com.cellparser.ast;

public sealed interface Statement extends Node permits
    ExpressionStatement,
    BlockStatement,
    EmptyStatement,
    DebuggerStatement,
    WithStatement,
    ReturnStatement,
    BreakStatement,
    ContinueStatement,
    IfStatement,
    SwitchStatement,
    ThrowStatement,
    TryStatement,
    WhileStatement,
    DoWhileStatement,
    ForStatement,
    ForInStatement,
    ForOfStatement,
    LabeledStatement,
    VariableDeclaration,
    FunctionDeclaration,
    ClassDeclaration,
    ImportDeclaration {
}
