package com.godzilla.json;

/**
 * Exception thrown when JSON serialization or deserialization fails.
 *
 * <p>For decode failures the exception names the offending node: its
 * {@code type} tag when one could be determined, the line/column in the JSON
 * document, and the property path from the root (for example
 * {@code program.body[0].expression}).</p>
 */
public class AstJsonException extends RuntimeException {

    private final String nodeType;
    private final int line;
    private final int column;
    private final String path;

    public AstJsonException(String message) {
        this(message, null, -1, -1, "", null);
    }

    public AstJsonException(String message, Throwable cause) {
        this(message, null, -1, -1, "", cause);
    }

    public AstJsonException(String message, String nodeType, int line, int column, String path, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
        this.line = line;
        this.column = column;
        this.path = path == null ? "" : path;
    }

    /**
     * The discriminator tag of the node being decoded when the failure occurred,
     * or {@code null} if not known (e.g. the {@code type} property itself was missing).
     */
    public String getNodeType() {
        return nodeType;
    }

    /** 1-based line in the JSON document, or -1 when unknown. */
    public int getLine() {
        return line;
    }

    /** 1-based column in the JSON document, or -1 when unknown. */
    public int getColumn() {
        return column;
    }

    /** Property path from the document root; empty for the root itself. */
    public String getPath() {
        return path;
    }
}
