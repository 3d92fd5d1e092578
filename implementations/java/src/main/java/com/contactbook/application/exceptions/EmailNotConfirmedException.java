package com.contactbook.application.exceptions;

/**
 * Login with a correct password for an account whose email is not confirmed yet.
 * Kept distinct from bad credentials so the client can offer to resend the confirmation.
 */
public class EmailNotConfirmedException extends UnauthenticatedException {

    public EmailNotConfirmedException() {
        super("Email address not confirmed");
    }
}
