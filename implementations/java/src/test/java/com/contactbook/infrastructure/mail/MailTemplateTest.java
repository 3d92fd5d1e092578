package com.contactbook.infrastructure.mail;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MailTemplate Tests")
class MailTemplateTest {

    @Test
    @DisplayName("Should substitute every placeholder")
    void rendersPlaceholders() {
        String body = MailTemplate.CONFIRM_EMAIL.render(Map.of("username", "alice", "link", "http://h/x"));

        assertThat(body)
            .contains("Hi alice,")
            .contains("<a href=\"http://h/x\">http://h/x</a>")
            .doesNotContain("${");
    }

    @Test
    @DisplayName("Should refuse to render with a missing variable")
    void missingVariable() {
        assertThatThrownBy(() -> MailTemplate.RESET_PASSWORD.render(Map.of("username", "alice")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
