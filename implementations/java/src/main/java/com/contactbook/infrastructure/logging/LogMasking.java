package com.contactbook.infrastructure.logging;

/**
 * Helpers for keeping personal data out of log lines.
 */
public final class LogMasking {

    private LogMasking() {
    }

    /**
     * {@code alice@example.com} becomes {@code a***@example.com}.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "<none>";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
