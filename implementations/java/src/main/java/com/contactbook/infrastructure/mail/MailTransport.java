package com.contactbook.infrastructure.mail;

import java.util.Map;

/**
 * Outbound mail channel.
 */
public interface MailTransport {

    /**
     * Deliver one message.
     *
     * @param recipient recipient address
     * @param template message template
     * @param variables template placeholder values
     * @throws org.springframework.mail.MailException if delivery fails
     */
    void send(String recipient, MailTemplate template, Map<String, String> variables);
}
