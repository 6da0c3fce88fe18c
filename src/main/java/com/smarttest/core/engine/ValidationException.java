package com.smarttest.core.engine;

/**
 * Thrown when caller input is malformed, e.g. a confirmation that is neither confirm nor retest.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
