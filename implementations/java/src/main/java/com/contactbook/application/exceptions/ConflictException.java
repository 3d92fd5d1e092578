package com.contactbook.application.exceptions;

/**
 * A uniqueness rule was violated: duplicate username, user email, or a contact whose
 * email or phone already exists for the same owner.
 * HTTP Status: 409 Conflict
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
