package com.contactbook.application;

import com.contactbook.application.exceptions.ConflictException;
import com.contactbook.application.exceptions.NotFoundException;
import com.contactbook.domain.model.Contact;
import com.contactbook.domain.model.ContactDraft;
import com.contactbook.domain.model.ContactFilter;
import com.contactbook.domain.model.ContactPatch;
import com.contactbook.domain.model.Principal;
import com.contactbook.domain.repository.ContactDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import static com.contactbook.infrastructure.logging.LogMasking.maskEmail;

/**
 * Application service for contact use cases.
 *
 * <p>The acting principal is always an explicit argument and is handed unchanged to the
 * {@link ContactDirectory}, which does the owner scoping. Absent and foreign contacts
 * both surface as {@link NotFoundException}.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ContactService {

    static final String CONTACT_NOT_FOUND = "Contact not found";

    private final ContactDirectory contactDirectory;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Contact> search(ContactFilter filter, int skip, int limit, Principal principal) {
        return contactDirectory.search(filter, skip, limit, principal);
    }

    @Transactional(readOnly = true)
    public Contact get(Long id, Principal principal) {
        return contactDirectory.findById(id, principal)
            .orElseThrow(() -> new NotFoundException(CONTACT_NOT_FOUND));
    }

    /**
     * Create a contact after checking the principal has no contact with the same email
     * or phone. A concurrent insert that slips past the check is still reported as a
     * conflict by the directory.
     */
    public Contact create(ContactDraft draft, Principal principal) {
        if (contactDirectory.existsByEmailOrPhone(draft.email(), draft.phone(), principal)) {
            log.info("Duplicate contact rejected: principal={}, email={}",
                principal.getId(), maskEmail(draft.email()));
            throw new ConflictException("Contact with '" + draft.email() + "' email or '"
                + draft.phone() + "' phone number already exists.");
        }
        return contactDirectory.create(draft, principal);
    }

    public Contact update(Long id, ContactPatch patch, Principal principal) {
        return contactDirectory.update(id, patch, principal)
            .orElseThrow(() -> new NotFoundException(CONTACT_NOT_FOUND));
    }

    public Contact delete(Long id, Principal principal) {
        return contactDirectory.delete(id, principal)
            .orElseThrow(() -> new NotFoundException(CONTACT_NOT_FOUND));
    }

    /**
     * Contacts with a birthday between today and {@code days} days from now, inclusive.
     */
    @Transactional(readOnly = true)
    public List<Contact> upcomingBirthdays(int days, Principal principal) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative");
        }
        return contactDirectory.upcomingBirthdays(days, LocalDate.now(clock), principal);
    }
}
