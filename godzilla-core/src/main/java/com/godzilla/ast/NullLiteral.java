package com.godzilla.ast;

public record NullLiteral(
    int start,
    int end,
    SourceLocation loc
) implements Literal {

    @Override
    public String type() {
        return "NullLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
