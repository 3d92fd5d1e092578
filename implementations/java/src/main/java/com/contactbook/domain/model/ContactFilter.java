package com.contactbook.domain.model;

/**
 * Substring filters for contact search. Null or empty filters match everything;
 * non-blank filters are combined with AND.
 */
public record ContactFilter(String name, String surname, String email) {

    /**
     * Escape character for the generated LIKE patterns; queries must declare
     * {@code ESCAPE '!'}.
     */
    public static final char LIKE_ESCAPE = '!';

    public static ContactFilter none() {
        return new ContactFilter(null, null, null);
    }

    public String namePattern() {
        return likePattern(name);
    }

    public String surnamePattern() {
        return likePattern(surname);
    }

    public String emailPattern() {
        return likePattern(email);
    }

    private static String likePattern(String value) {
        if (value == null || value.isEmpty()) {
            return "%";
        }
        String escaped = value
            .replace(String.valueOf(LIKE_ESCAPE), "" + LIKE_ESCAPE + LIKE_ESCAPE)
            .replace("%", LIKE_ESCAPE + "%")
            .replace("_", LIKE_ESCAPE + "_");
        return "%" + escaped + "%";
    }
}
