package com.godzilla.ast;

import java.util.List;
import java.util.Objects;

public record CallExpression(
    int start,
    int end,
    SourceLocation loc,
    Expression callee,
    List<Expression> arguments
) implements Expression {

    public CallExpression {
        Objects.requireNonNull(callee, "CallExpression requires a callee");
        if (arguments == null) {
            arguments = List.of();
        } else {
            arguments.forEach(e -> Objects.requireNonNull(e, "CallExpression arguments contain a null expression"));
            arguments = List.copyOf(arguments);
        }
    }

    @Override
    public String type() {
        return "CallExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
