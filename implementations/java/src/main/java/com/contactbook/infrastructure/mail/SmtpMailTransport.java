package com.contactbook.infrastructure.mail;

import com.contactbook.config.MailProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static com.contactbook.infrastructure.logging.LogMasking.maskEmail;

/**
 * Sends HTML mail through the SMTP server configured under {@code spring.mail.*}.
 */
@Component
@ConditionalOnProperty(prefix = "contactbook.mail", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SmtpMailTransport implements MailTransport {

    private final JavaMailSender mailSender;
    private final MailProperties properties;

    @Override
    public void send(String recipient, MailTemplate template, Map<String, String> variables) {
        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.getFrom(), properties.getFromName());
            helper.setTo(recipient);
            helper.setSubject(template.getSubject());
            helper.setText(template.render(variables), true);
        } catch (MessagingException | UnsupportedEncodingException e) {
            throw new MailPreparationException("Could not build " + template + " message", e);
        }

        mailSender.send(message);
        log.info("Mail sent: template={}, to={}", template, maskEmail(recipient));
    }
}
