package com.contactbook.interfaces.api.dto;

import com.contactbook.domain.model.Contact;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Response DTO for contact data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactResponse {

    private Long id;
    private String name;
    private String surname;
    private String email;
    private String phone;
    private LocalDate birthday;
    private String info;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public static ContactResponse from(Contact contact) {
        return ContactResponse.builder()
            .id(contact.getId())
            .name(contact.getName())
            .surname(contact.getSurname())
            .email(contact.getEmail())
            .phone(contact.getPhone())
            .birthday(contact.getBirthday())
            .info(contact.getInfo())
            .createdAt(contact.getCreatedAt())
            .updatedAt(contact.getUpdatedAt())
            .build();
    }
}
