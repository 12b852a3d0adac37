package com.godzilla.ast;

/**
 * Nodes that may appear in a program or block body.
 */
public sealed interface Statement extends Node permits
    ExpressionStatement,
    Declaration {
}
