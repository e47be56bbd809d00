package com.transform.graphselect;

/**
 * Raised by graph construction for dependency cycles and edges to unknown nodes.
 */
public class GraphIntegrityException extends GraphSelectException {
    public GraphIntegrityException(String message) {
        super(message);
    }
}
