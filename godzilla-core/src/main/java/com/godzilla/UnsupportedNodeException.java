package com.godzilla;

import com.godzilla.ast.Node;

/**
 * Thrown when the emitter is asked to compile a node it is configured not to
 * handle. The sink receives no output from the failed compilation.
 */
public class UnsupportedNodeException extends RuntimeException {

    private final transient Node node;

    public UnsupportedNodeException(Node node, String message) {
        super(message + " (" + node.attr().describe() + ")");
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
