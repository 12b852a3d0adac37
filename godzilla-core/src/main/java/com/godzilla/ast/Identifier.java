package com.godzilla.ast;

public record Identifier(
    int start,
    int end,
    SourceLocation loc,
    String name
) implements Expression {

    public Identifier {
        name = name == null ? "" : name;
    }

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
