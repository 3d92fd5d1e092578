package com.contactbook.infrastructure.mail;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.util.PropertyPlaceholderHelper;

import java.util.Map;

/**
 * Transactional emails sent by the service. Bodies are HTML with {@code ${name}}
 * placeholders.
 */
@Getter
@RequiredArgsConstructor
public enum MailTemplate {

    CONFIRM_EMAIL(
        "Confirm your email",
        "<p>Hi ${username},</p>"
            + "<p>Please confirm your email address by following this link:</p>"
            + "<p><a href=\"${link}\">${link}</a></p>"),

    RESET_PASSWORD(
        "Important: Update your account information",
        "<p>Hi ${username},</p>"
            + "<p>We received a request to change the password of your account. "
            + "Follow this link to apply the new password:</p>"
            + "<p><a href=\"${link}\">${link}</a></p>"
            + "<p>If you did not request this, ignore this email.</p>");

    private static final PropertyPlaceholderHelper PLACEHOLDERS = new PropertyPlaceholderHelper("${", "}", null, false);

    private final String subject;
    private final String body;

    /**
     * @throws IllegalArgumentException if a placeholder has no value
     */
    public String render(Map<String, String> variables) {
        return PLACEHOLDERS.replacePlaceholders(body, variables::get);
    }
}
