package com.godzilla;

import java.util.Objects;

/**
 * Settings for {@link Emitter}.
 *
 * @param declarations how variable declarations are compiled
 */
public record EmitterOptions(DeclarationMode declarations) {

    public EmitterOptions {
        Objects.requireNonNull(declarations, "declarations");
    }

    public static EmitterOptions defaults() {
        return new EmitterOptions(DeclarationMode.EMIT);
    }

    public EmitterOptions withDeclarations(DeclarationMode mode) {
        return new EmitterOptions(mode);
    }

    /**
     * Treatment of {@code VariableDeclaration} and {@code VariableDeclarator} nodes.
     */
    public enum DeclarationMode {
        /** Emit Go {@code var}/{@code const} declarations. */
        EMIT,
        /** Emit nothing for declarations and log a warning for each one skipped. */
        SKIP,
        /** Reject the whole compilation with {@link UnsupportedNodeException}. */
        FAIL;

        /**
         * Parses a mode name case-insensitively, as given on the command line.
         */
        public static DeclarationMode parse(String name) {
            Objects.requireNonNull(name, "name");
            for (DeclarationMode mode : values()) {
                if (mode.name().equalsIgnoreCase(name.trim())) {
                    return mode;
                }
            }
            throw new IllegalArgumentException(
                "Unknown declaration mode '" + name + "', expected one of emit, skip, fail");
        }
    }
}
