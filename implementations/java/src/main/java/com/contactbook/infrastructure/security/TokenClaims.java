package com.contactbook.infrastructure.security;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Claim shapes carried by the three kinds of token.
 *
 * <p>All variants share one signing key. Each carries a {@code scope} claim naming its
 * {@link TokenPurpose}; reset tokens additionally carry the pre-hashed new password.
 */
public sealed interface TokenClaims
        permits TokenClaims.Session, TokenClaims.Confirmation, TokenClaims.PasswordReset {

    String SUBJECT = "sub";
    String PASSWORD = "password";
    String SCOPE = "scope";

    TokenPurpose purpose();

    /**
     * @return claims to embed, without {@code iat}/{@code exp}
     */
    Map<String, Object> toClaims();

    /**
     * Session token: subject is the username.
     */
    record Session(String username) implements TokenClaims {
        @Override
        public TokenPurpose purpose() {
            return TokenPurpose.SESSION;
        }

        @Override
        public Map<String, Object> toClaims() {
            return Map.of(SUBJECT, username, SCOPE, purpose().getScope());
        }
    }

    /**
     * Email-confirmation token: subject is the email.
     */
    record Confirmation(String email) implements TokenClaims {
        @Override
        public TokenPurpose purpose() {
            return TokenPurpose.EMAIL_CONFIRMATION;
        }

        @Override
        public Map<String, Object> toClaims() {
            return Map.of(SUBJECT, email, SCOPE, purpose().getScope());
        }
    }

    /**
     * Password-reset token: subject is the email, plus the new password's digest.
     */
    record PasswordReset(String email, String passwordHash) implements TokenClaims {
        @Override
        public TokenPurpose purpose() {
            return TokenPurpose.PASSWORD_RESET;
        }

        @Override
        public Map<String, Object> toClaims() {
            Map<String, Object> claims = new LinkedHashMap<>();
            claims.put(SUBJECT, email);
            claims.put(SCOPE, purpose().getScope());
            claims.put(PASSWORD, passwordHash);
            return claims;
        }

        @Override
        public String toString() {
            return "PasswordReset[email=" + email + ", passwordHash=***]";
        }
    }
}
