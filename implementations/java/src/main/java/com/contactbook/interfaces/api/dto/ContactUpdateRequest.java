package com.contactbook.interfaces.api.dto;

import com.contactbook.domain.model.ContactPatch;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for a partial contact update. Omitted fields keep their stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactUpdateRequest {

    @Size(min = 2, max = 50, message = "Name must be between 2 and 50 characters")
    private String name;

    @Size(min = 2, max = 50, message = "Surname must be between 2 and 50 characters")
    private String surname;

    @Email(message = "Email must be valid")
    @Size(max = 100, message = "Email must not exceed 100 characters")
    private String email;

    @Size(min = 7, max = 20, message = "Phone must be between 7 and 20 characters")
    private String phone;

    private LocalDate birthday;

    @Size(max = 500, message = "Info must not exceed 500 characters")
    private String info;

    public ContactPatch toPatch() {
        return new ContactPatch(name, surname, email, phone, birthday, info);
    }
}
