package com.godzilla.ast;

public record StringLiteral(
    int start,
    int end,
    SourceLocation loc,
    String value,
    Extra extra     // Can be null
) implements Literal {

    public StringLiteral {
        value = value == null ? "" : value;
    }

    @Override
    public String type() {
        return "StringLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
