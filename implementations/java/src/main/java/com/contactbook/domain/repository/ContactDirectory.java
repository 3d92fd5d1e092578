package com.contactbook.domain.repository;

import com.contactbook.domain.model.Contact;
import com.contactbook.domain.model.ContactDraft;
import com.contactbook.domain.model.ContactFilter;
import com.contactbook.domain.model.ContactPatch;
import com.contactbook.domain.model.Principal;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for contacts, scoped to the acting principal.
 *
 * <p>Every method takes the caller's {@link Principal} and only ever sees that
 * principal's own contacts. A contact owned by someone else behaves exactly like a
 * contact that does not exist.
 */
public interface ContactDirectory {

    /**
     * Search the principal's contacts.
     *
     * @param filter substring filters, ANDed
     * @param skip number of rows to skip
     * @param limit maximum number of rows to return
     * @param principal acting user
     * @return matching contacts ordered by id
     */
    List<Contact> search(ContactFilter filter, int skip, int limit, Principal principal);

    /**
     * @param id contact id
     * @param principal acting user
     * @return the contact if it exists and belongs to the principal
     */
    Optional<Contact> findById(Long id, Principal principal);

    /**
     * Duplicate check within the principal's contacts.
     *
     * @return true if any of the principal's contacts has the email OR the phone
     */
    boolean existsByEmailOrPhone(String email, String phone, Principal principal);

    /**
     * @throws com.contactbook.application.exceptions.ConflictException on a per-owner
     *         email or phone collision detected by the database
     */
    Contact create(ContactDraft draft, Principal principal);

    /**
     * Overwrite the supplied fields of an owned contact.
     *
     * @return the updated contact, or empty if it is absent or not owned
     */
    Optional<Contact> update(Long id, ContactPatch patch, Principal principal);

    /**
     * @return the removed contact, or empty if it is absent or not owned
     */
    Optional<Contact> delete(Long id, Principal principal);

    /**
     * Contacts whose birthday month-day falls within {@code [today, today + windowDays]},
     * wrapping across the year end.
     *
     * @return contacts ordered by position within the window
     */
    List<Contact> upcomingBirthdays(int windowDays, LocalDate today, Principal principal);
}
