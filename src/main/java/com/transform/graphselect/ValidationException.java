package com.transform.graphselect;

/**
 * Raised for malformed manifest content, including YAML syntax errors.
 */
public class ValidationException extends GraphSelectException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
