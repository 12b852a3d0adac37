package com.godzilla.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Append-only destination for emitted Go text. Writes arrive in traversal
 * order; flushing and closing belong to whoever owns the underlying target.
 *
 * <p>A sink must not be shared by two compilations in flight.</p>
 */
public interface Code {

    void write(String text);

    /**
     * Adapts any {@link Appendable} (a {@code Writer}, {@code PrintStream},
     * {@code StringBuilder}, ...) to a sink.
     *
     * @throws UncheckedIOException from {@link #write} when the target fails
     */
    static Code of(Appendable target) {
        Objects.requireNonNull(target, "target");
        return text -> {
            try {
                target.append(text);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write emitted code", e);
            }
        };
    }
}
