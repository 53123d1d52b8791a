package io.tabtick.core;

/** A required parameter is missing or out of range. Raised before any side effect. */
public class ValidationException extends TabTickException {

    public ValidationException(String message) {
        super(message);
    }
}
