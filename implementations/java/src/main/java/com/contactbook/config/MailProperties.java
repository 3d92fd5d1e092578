package com.contactbook.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound mail settings bound from {@code contactbook.mail.*}. SMTP connection
 * details live under the standard {@code spring.mail.*} keys.
 */
@ConfigurationProperties(prefix = "contactbook.mail")
@Getter
@Setter
@ToString
public class MailProperties {

    /**
     * Send through SMTP. When false, messages are only logged.
     */
    private boolean enabled = false;

    private String from = "no-reply@contactbook.local";

    private String fromName = "Contact Book";

    /**
     * Public base URL used to build links in emails. Must end with a slash.
     */
    private String baseUrl = "http://localhost:8080/";

    /**
     * Worker threads for asynchronous mail dispatch.
     */
    private int executorPoolSize = 2;

    private int executorQueueCapacity = 500;
}
