package com.godzilla.ast;

import java.util.Objects;

/**
 * Document root. Owns exactly one {@link Program}.
 */
public record File(
    int start,
    int end,
    SourceLocation loc,
    Program program
) implements Node {

    public File {
        Objects.requireNonNull(program, "File requires a program");
    }

    @Override
    public String type() {
        return "File";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
