package com.smarttest.core.persistence;

/**
 * Wraps storage failures (SQL errors, unreadable JSON columns).
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
