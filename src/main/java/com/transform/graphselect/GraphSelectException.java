package com.transform.graphselect;

/**
 * Base type for every failure raised while loading a graph or resolving a selection.
 */
public class GraphSelectException extends RuntimeException {
    public GraphSelectException(String message) {
        super(message);
    }

    public GraphSelectException(String message, Throwable cause) {
        super(message, cause);
    }
}
