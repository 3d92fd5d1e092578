package com.contactbook.application.exceptions;

/**
 * Exception thrown when communication with an external collaborator fails.
 * For example: the avatar image host is not configured or rejects the upload.
 * HTTP Status: 502 Bad Gateway
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
