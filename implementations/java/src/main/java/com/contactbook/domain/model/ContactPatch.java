package com.contactbook.domain.model;

import java.time.LocalDate;

/**
 * Partial contact update. A {@code null} component leaves the stored value unchanged.
 */
public record ContactPatch(
    String name,
    String surname,
    String email,
    String phone,
    LocalDate birthday,
    String info
) {
}
