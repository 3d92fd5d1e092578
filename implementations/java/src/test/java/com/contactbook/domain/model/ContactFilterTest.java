package com.contactbook.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContactFilter Unit Tests")
class ContactFilterTest {

    @Test
    @DisplayName("Should match everything when a filter is empty")
    void emptyMatchesAll() {
        ContactFilter filter = new ContactFilter("", null, "");

        assertThat(filter.namePattern()).isEqualTo("%");
        assertThat(filter.surnamePattern()).isEqualTo("%");
        assertThat(filter.emailPattern()).isEqualTo("%");
    }

    @Test
    @DisplayName("Should wrap the value for a substring match")
    void substring() {
        assertThat(new ContactFilter("Bo", null, null).namePattern()).isEqualTo("%Bo%");
    }

    @Test
    @DisplayName("Should escape LIKE wildcards so they match literally")
    void escapesWildcards() {
        assertThat(new ContactFilter(null, null, "a_b%c!").emailPattern()).isEqualTo("%a!_b!%c!!%");
    }
}
