package com.godzilla.ast;

public record BooleanLiteral(
    int start,
    int end,
    SourceLocation loc,
    boolean value
) implements Literal {

    @Override
    public String type() {
        return "BooleanLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
