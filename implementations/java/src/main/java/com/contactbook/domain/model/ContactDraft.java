package com.contactbook.domain.model;

import java.time.LocalDate;

/**
 * Data for a new contact, already validated at the API edge.
 */
public record ContactDraft(
    String name,
    String surname,
    String email,
    String phone,
    LocalDate birthday,
    String info
) {}
