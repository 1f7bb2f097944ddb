package com.cellparser.ast;

public sealed interface Pattern extends Node permits
    Identifier,
    MemberExpression,
    ObjectPattern,
    ArrayPattern,
    RestElement,
    AssignmentPattern,
    MutableExpression {
}
