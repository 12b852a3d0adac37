package com.godzilla.ast;

import java.util.Objects;

/**
 * Property access. {@code computed} distinguishes {@code a[b]} from {@code a.b}.
 */
public record MemberExpression(
    int start,
    int end,
    SourceLocation loc,
    Expression object,
    Expression property,
    boolean computed
) implements Expression {

    public MemberExpression {
        Objects.requireNonNull(object, "MemberExpression requires an object");
        Objects.requireNonNull(property, "MemberExpression requires a property");
    }

    @Override
    public String type() {
        return "MemberExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
