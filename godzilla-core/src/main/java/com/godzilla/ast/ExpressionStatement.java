package com.godzilla.ast;

import java.util.Objects;

public record ExpressionStatement(
    int start,
    int end,
    SourceLocation loc,
    Expression expression
) implements Statement {

    public ExpressionStatement {
        Objects.requireNonNull(expression, "ExpressionStatement requires an expression");
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
