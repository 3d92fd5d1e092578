package com.contactbook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the multi-tenant contact book.
 *
 * <p>Each registered user owns a private set of contacts. The service provides:
 *
 * <ul>
 *   <li><strong>Accounts</strong>: registration, email confirmation, login and password
 *       reset through signed, single-purpose tokens</li>
 *   <li><strong>Access control</strong>: stateless bearer tokens resolved to a principal
 *       on every request</li>
 *   <li><strong>Per-user isolation</strong>: every contact query is scoped to its owner
 *       in the persistence adapter</li>
 *   <li><strong>Contacts</strong>: search, partial update and upcoming-birthday queries</li>
 * </ul>
 *
 * <p><strong>Deployment:</strong>
 * <ul>
 *   <li>PostgreSQL 15+</li>
 *   <li>SMTP relay for account emails (optional; logged when disabled)</li>
 *   <li>Cloudinary for admin avatars (optional)</li>
 * </ul>
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class ContactBookApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContactBookApplication.class, args);

        log.info("Contact Book started");
    }
}
