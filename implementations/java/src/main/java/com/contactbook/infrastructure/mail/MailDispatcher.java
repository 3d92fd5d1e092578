package com.contactbook.infrastructure.mail;

import com.contactbook.config.MailProperties;
import com.contactbook.infrastructure.security.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.contactbook.infrastructure.logging.LogMasking.maskEmail;

/**
 * Fire-and-forget delivery of the account emails.
 *
 * <p>Runs on the {@code mailTaskExecutor} pool. A delivery failure is logged here and
 * never reaches the request that triggered it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailDispatcher {

    static final String CONFIRM_PATH = "api/auth/confirmed_email/";
    static final String RESET_PATH = "api/auth/confirm_reset_password/";

    private final MailTransport mailTransport;
    private final TokenService tokenService;
    private final MailProperties properties;

    /**
     * Mint a confirmation token for the email and send the confirmation link.
     */
    @Async("mailTaskExecutor")
    public void sendConfirmation(String email, String username) {
        try {
            String token = tokenService.issueConfirmationToken(email);
            deliver(email, MailTemplate.CONFIRM_EMAIL, Map.of(
                "username", username,
                "link", link(CONFIRM_PATH, token)));
        } catch (RuntimeException e) {
            log.error("Confirmation email to {} failed", maskEmail(email), e);
        }
    }

    /**
     * Send the link that applies a pending password reset.
     */
    @Async("mailTaskExecutor")
    public void sendPasswordReset(String email, String username, String resetToken) {
        try {
            deliver(email, MailTemplate.RESET_PASSWORD, Map.of(
                "username", username,
                "link", link(RESET_PATH, resetToken)));
        } catch (RuntimeException e) {
            log.error("Password reset email to {} failed", maskEmail(email), e);
        }
    }

    private void deliver(String email, MailTemplate template, Map<String, String> variables) {
        mailTransport.send(email, template, variables);
        log.debug("Dispatched {} to {}", template, maskEmail(email));
    }

    private String link(String path, String token) {
        String base = properties.getBaseUrl();
        if (!base.endsWith("/")) {
            base = base + "/";
        }
        return base + path + token;
    }
}
