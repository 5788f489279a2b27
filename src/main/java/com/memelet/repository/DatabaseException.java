package com.memelet.repository;

/**
 * Unchecked wrapper for storage failures raised by the catalog.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
