package com.cellparser.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Literal,
    TemplateLiteral,
    TaggedTemplateExpression,
    ThisExpression,
    Super,
    ArrayExpression,
    ObjectExpression,
    FunctionExpression,
    ArrowFunctionExpression,
    ClassExpression,
    UnaryExpression,
    UpdateExpression,
    BinaryExpression,
    LogicalExpression,
    AssignmentExpression,
    ConditionalExpression,
    CallExpression,
    NewExpression,
    MemberExpression,
    ChainExpression,
    SequenceExpression,
    SpreadElement,
    YieldExpression,
    AwaitExpression,
    ImportExpression,
    MetaProperty,
    ViewExpression,
    MutableExpression {
}
