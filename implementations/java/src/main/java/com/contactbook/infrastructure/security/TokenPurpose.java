package com.contactbook.infrastructure.security;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What a bearer token is presented for. Each purpose has its own {@code scope} claim
 * value, so a token minted for one purpose never verifies for another, and its own
 * client-facing message when the token is rejected.
 */
@Getter
@RequiredArgsConstructor
public enum TokenPurpose {
    SESSION("access", "Could not validate credentials"),
    EMAIL_CONFIRMATION("email_confirm", "Invalid email verification token"),
    PASSWORD_RESET("password_reset", "Invalid or expired token");

    private final String scope;
    private final String failureMessage;
}
