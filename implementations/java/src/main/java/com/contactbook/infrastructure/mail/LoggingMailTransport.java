package com.contactbook.infrastructure.mail;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.contactbook.infrastructure.logging.LogMasking.maskEmail;

/**
 * Development transport used when SMTP is disabled. Logs that a message would have
 * been sent; the body is logged at debug only since it carries a live token.
 */
@Component
@ConditionalOnProperty(prefix = "contactbook.mail", name = "enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class LoggingMailTransport implements MailTransport {

    @Override
    public void send(String recipient, MailTemplate template, Map<String, String> variables) {
        log.info("Mail delivery disabled, not sending {} to {}", template, maskEmail(recipient));
        if (log.isDebugEnabled()) {
            log.debug("Suppressed mail body:\n{}", template.render(variables));
        }
    }
}
