package com.contactbook.application.exceptions;

/**
 * Authenticated caller lacks the role required for the operation.
 * HTTP Status: 403 Forbidden
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
