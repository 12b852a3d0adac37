package com.godzilla.ast;

/**
 * Expressions with a fixed value.
 */
public sealed interface Literal extends Expression permits
    StringLiteral,
    NumericLiteral,
    BooleanLiteral,
    NullLiteral {
}
