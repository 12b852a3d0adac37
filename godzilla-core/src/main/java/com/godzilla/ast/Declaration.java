package com.godzilla.ast;

/**
 * Statements that introduce bindings.
 */
public sealed interface Declaration extends Statement permits
    VariableDeclaration {
}
