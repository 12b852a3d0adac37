package com.godzilla.ast;

public sealed interface Expression extends Node permits
    Identifier,
    CallExpression,
    MemberExpression,
    Literal {
}
