package com.contactbook.interfaces.api;

import com.contactbook.application.ContactService;
import com.contactbook.domain.model.Contact;
import com.contactbook.domain.model.ContactFilter;
import com.contactbook.domain.model.Principal;
import com.contactbook.interfaces.api.dto.ContactRequest;
import com.contactbook.interfaces.api.dto.ContactResponse;
import com.contactbook.interfaces.api.dto.ContactUpdateRequest;
import com.contactbook.interfaces.api.dto.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the caller's own contacts.
 *
 * Security:
 * - All endpoints require a bearer token
 * - Every operation is scoped to the authenticated principal; other users' contacts
 *   answer 404 exactly like missing ones
 */
@RestController
@RequestMapping("/api/contacts")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Contacts", description = "Contact management operations")
@SecurityRequirement(name = "bearerAuth")
public class ContactRestController {

    private final ContactService contactService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List contacts", description = "Substring filters on name, surname and email, combined with AND")
    public List<ContactResponse> listContacts(
            @RequestParam(value = "name", defaultValue = "") String name,
            @RequestParam(value = "surname", defaultValue = "") String surname,
            @RequestParam(value = "email", defaultValue = "") String email,
            @RequestParam(value = "skip", defaultValue = "0") @Min(0) int skip,
            @RequestParam(value = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit,
            @AuthenticationPrincipal Principal principal) {

        return toResponses(contactService.search(new ContactFilter(name, surname, email), skip, limit, principal));
    }

    @GetMapping(value = "/birthdays", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Upcoming birthdays",
        description = "Contacts whose birthday falls between today and the given number of days from now")
    public List<ContactResponse> upcomingBirthdays(
            @RequestParam(value = "days", defaultValue = "7") @Min(1) int days,
            @AuthenticationPrincipal Principal principal) {

        return toResponses(contactService.upcomingBirthdays(days, principal));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get contact by ID")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Contact found",
            content = @Content(schema = @Schema(implementation = ContactResponse.class))),
        @ApiResponse(responseCode = "404", description = "Contact not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ContactResponse getContact(@PathVariable("id") Long id, @AuthenticationPrincipal Principal principal) {
        return ContactResponse.from(contactService.get(id, principal));
    }

    @PostMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Create new contact")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Contact created successfully",
            content = @Content(schema = @Schema(implementation = ContactResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "409", description = "A contact with this email or phone already exists",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ContactResponse> createContact(
            @Valid @RequestBody ContactRequest request,
            @AuthenticationPrincipal Principal principal) {

        Contact contact = contactService.create(request.toDraft(), principal);

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ContactResponse.from(contact));
    }

    @PutMapping(
        value = "/{id}",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Update contact", description = "Overwrites only the fields present in the body")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Contact updated",
            content = @Content(schema = @Schema(implementation = ContactResponse.class))),
        @ApiResponse(responseCode = "404", description = "Contact not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "409", description = "Another contact already has this email or phone",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ContactResponse updateContact(
            @PathVariable("id") Long id,
            @Valid @RequestBody ContactUpdateRequest request,
            @AuthenticationPrincipal Principal principal) {

        return ContactResponse.from(contactService.update(id, request.toPatch(), principal));
    }

    @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Delete contact", description = "Removes the contact and returns it")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Contact deleted",
            content = @Content(schema = @Schema(implementation = ContactResponse.class))),
        @ApiResponse(responseCode = "404", description = "Contact not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ContactResponse deleteContact(@PathVariable("id") Long id, @AuthenticationPrincipal Principal principal) {
        Contact removed = contactService.delete(id, principal);
        log.info("Contact removed via API: id={}", removed.getId());
        return ContactResponse.from(removed);
    }

    private static List<ContactResponse> toResponses(List<Contact> contacts) {
        return contacts.stream().map(ContactResponse::from).toList();
    }
}
