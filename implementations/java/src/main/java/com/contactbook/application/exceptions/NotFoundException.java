package com.contactbook.application.exceptions;

/**
 * The requested record does not exist, or exists but belongs to another user.
 * Both cases are reported identically.
 * HTTP Status: 404 Not Found
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
