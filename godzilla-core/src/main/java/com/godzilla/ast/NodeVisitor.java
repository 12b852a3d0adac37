package com.godzilla.ast;

/**
 * One method per concrete node kind. Implementations are the traversals over
 * the tree; adding a node kind adds an overload here.
 *
 * @param <R> result of visiting a node
 */
public interface NodeVisitor<R> {

    R visit(File node);

    R visit(Program node);

    // statements

    R visit(ExpressionStatement node);

    // declarations

    R visit(VariableDeclaration node);

    R visit(VariableDeclarator node);

    // expressions

    R visit(Identifier node);

    R visit(CallExpression node);

    R visit(MemberExpression node);

    // literals

    R visit(StringLiteral node);

    R visit(NumericLiteral node);

    R visit(BooleanLiteral node);

    R visit(NullLiteral node);
}
