package com.godzilla.ast;

import com.godzilla.Emitter;
import com.godzilla.Stringifier;
import com.godzilla.source.Code;

/**
 * Base interface for all AST nodes.
 *
 * <p>The permitted hierarchy is closed: a new node kind is added by writing its
 * record, listing it under the category interfaces it belongs to, and giving it
 * a {@code visit} overload in {@link NodeVisitor}. Every traversal then fails to
 * compile until it handles the new kind.</p>
 */
public sealed interface Node permits
    File,
    Program,
    VariableDeclarator,
    Statement,
    Expression {

    String type();
    int start();
    int end();
    SourceLocation loc();

    <R> R accept(NodeVisitor<R> visitor);

    default Attr attr() {
        return new Attr(type(), start(), end(), loc());
    }

    /**
     * Reconstructs source text for this node.
     *
     * @see Stringifier
     */
    default String toSource() {
        return Stringifier.stringify(this);
    }

    /**
     * Writes Go text for this node into {@code code} using the default emitter options.
     *
     * @see Emitter
     */
    default void compile(Code code) {
        Emitter.defaultEmitter().compile(this, code);
    }
}
