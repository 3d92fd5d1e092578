package com.contactbook.application.exceptions;

/**
 * The caller could not be authenticated: bad credentials, or a missing, invalid or
 * expired bearer token.
 * HTTP Status: 401 Unauthorized
 */
public class UnauthenticatedException extends RuntimeException {

    public static final String INVALID_CREDENTIALS = "Invalid username or password";
    public static final String COULD_NOT_VALIDATE = "Could not validate credentials";

    public UnauthenticatedException(String message) {
        super(message);
    }
}
