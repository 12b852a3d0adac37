package com.godzilla.ast;

import java.util.Objects;
import java.util.Optional;

public record VariableDeclarator(
    int start,
    int end,
    SourceLocation loc,
    Identifier id,
    Expression init     // Can be null
) implements Node {

    public VariableDeclarator {
        Objects.requireNonNull(id, "VariableDeclarator requires an id");
    }

    public Optional<Expression> initializer() {
        return Optional.ofNullable(init);
    }

    @Override
    public String type() {
        return "VariableDeclarator";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
