package com.contactbook.interfaces.api.exception;

/**
 * Health check could not reach the database.
 * HTTP Status: 500 Internal Server Error, with the message exposed.
 */
public class DatabaseUnavailableException extends RuntimeException {

    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
