package com.godzilla.ast;

import java.util.List;
import java.util.Objects;

public record VariableDeclaration(
    int start,
    int end,
    SourceLocation loc,
    List<VariableDeclarator> declarations,
    String kind  // "var" | "let" | "const"
) implements Declaration {

    public VariableDeclaration {
        if (declarations == null) {
            declarations = List.of();
        } else {
            declarations.forEach(e -> Objects.requireNonNull(e, "VariableDeclaration contains a null declarator"));
            declarations = List.copyOf(declarations);
        }
        kind = kind == null ? "" : kind;
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
