package com.contactbook.application.exceptions;

import com.contactbook.infrastructure.security.TokenPurpose;
import lombok.Getter;

/**
 * A bearer token failed verification or does not carry the claims its purpose requires.
 *
 * <p>Bad signature, expiry and malformed structure are deliberately collapsed into this
 * one exception; the message never says which check failed.
 */
@Getter
public class InvalidTokenException extends RuntimeException {

    private final TokenPurpose purpose;

    public InvalidTokenException(TokenPurpose purpose) {
        super(purpose.getFailureMessage());
        this.purpose = purpose;
    }
}
