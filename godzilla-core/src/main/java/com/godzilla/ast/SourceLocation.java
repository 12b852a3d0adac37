package com.godzilla.ast;

/**
 * Line/column range of a node in the original source. Lines are 1-based,
 * columns 0-based, as the upstream parser reports them.
 */
public record SourceLocation(Position start, Position end) {

    public record Position(int line, int column) {}
}
