package com.godzilla.ast;

import java.util.List;
import java.util.Objects;

public record Program(
    int start,
    int end,
    SourceLocation loc,
    List<Statement> body,
    String sourceType  // "script" | "module"
) implements Node {

    public Program {
        if (body == null) {
            body = List.of();
        } else {
            body.forEach(e -> Objects.requireNonNull(e, "Program body contains a null statement"));
            body = List.copyOf(body);
        }
        sourceType = sourceType == null ? "" : sourceType;
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
