package com.transform.graphselect;

/**
 * Raised when a selection spec does not follow the selector grammar.
 */
public class InvalidSelectorException extends GraphSelectException {
    private final String spec;

    public InvalidSelectorException(String spec, String reason) {
        super("Invalid selector spec '" + spec + "': " + reason);
        this.spec = spec;
    }

    public String getSpec() {
        return spec;
    }
}
