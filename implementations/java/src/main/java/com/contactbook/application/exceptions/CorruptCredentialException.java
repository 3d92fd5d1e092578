package com.contactbook.application.exceptions;

/**
 * A stored password digest is missing or malformed. This is an internal fault, never
 * a failed password check.
 * HTTP Status: 500 Internal Server Error
 */
public class CorruptCredentialException extends IllegalStateException {

    public CorruptCredentialException(String message) {
        super(message);
    }
}
