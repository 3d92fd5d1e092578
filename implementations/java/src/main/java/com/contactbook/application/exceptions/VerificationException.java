package com.contactbook.application.exceptions;

/**
 * An email-confirmation or password-reset step cannot proceed for the addressed account.
 * HTTP Status: 400 Bad Request
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message) {
        super(message);
    }
}
