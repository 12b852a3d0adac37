package com.godzilla.source;

/**
 * In-memory sink. Not thread-safe.
 */
public final class StringCode implements Code {

    private final StringBuilder out = new StringBuilder();

    @Override
    public void write(String text) {
        out.append(text);
    }

    public boolean isEmpty() {
        return out.length() == 0;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
