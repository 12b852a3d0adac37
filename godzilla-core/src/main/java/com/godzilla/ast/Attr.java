package com.godzilla.ast;

/**
 * Metadata shared by every node: discriminator tag, byte-offset span and
 * optional line/column location.
 *
 * @param type  the discriminator tag, e.g. {@code "CallExpression"}
 * @param start byte offset of the first character covered by the node
 * @param end   byte offset just past the last character covered by the node
 * @param loc   line/column range, or {@code null} when the document carried none
 */
public record Attr(String type, int start, int end, SourceLocation loc) {

    /**
     * Short human readable position, used in diagnostics.
     */
    public String describe() {
        if (loc != null && loc.start() != null) {
            return type + " at " + loc.start().line() + ":" + loc.start().column();
        }
        return type + " at offset " + start;
    }
}
