package com.contactbook.infrastructure.persistence;

import com.contactbook.application.exceptions.ConflictException;
import com.contactbook.domain.model.BirthdayWindow;
import com.contactbook.domain.model.Contact;
import com.contactbook.domain.model.ContactDraft;
import com.contactbook.domain.model.ContactFilter;
import com.contactbook.domain.model.ContactPatch;
import com.contactbook.domain.model.Principal;
import com.contactbook.domain.model.UserAccount;
import com.contactbook.domain.repository.ContactDirectory;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing {@link ContactDirectory} on JPA.
 *
 * <p>Every query is qualified with {@code c.owner.id = :ownerId}; there is no code path
 * that reads or writes a contact without the acting principal's id. A contact owned by
 * another user is indistinguishable from a missing one.
 *
 * <p>Writes go through {@link SpringDataContactRepository#saveAndFlush} so the per-owner
 * unique constraints are checked inside this call and reported as
 * {@link ConflictException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaContactDirectory implements ContactDirectory {

    private static final String MONTH_DAY_KEY =
        "(extract(month from c.birthday) * 100 + extract(day from c.birthday))";

    private final SpringDataContactRepository contacts;

    private final EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public List<Contact> search(ContactFilter filter, int skip, int limit, Principal principal) {
        ContactFilter effective = (filter != null) ? filter : ContactFilter.none();

        TypedQuery<Contact> query = entityManager.createQuery(
                "SELECT c FROM Contact c WHERE c.owner.id = :ownerId"
                    + " AND c.name LIKE :name ESCAPE '!'"
                    + " AND c.surname LIKE :surname ESCAPE '!'"
                    + " AND c.email LIKE :email ESCAPE '!'"
                    + " ORDER BY c.id", Contact.class)
            .setParameter("ownerId", principal.getId())
            .setParameter("name", effective.namePattern())
            .setParameter("surname", effective.surnamePattern())
            .setParameter("email", effective.emailPattern())
            .setFirstResult(Math.max(skip, 0))
            .setMaxResults(Math.max(limit, 0));

        List<Contact> result = query.getResultList();
        if (log.isDebugEnabled()) {
            log.debug("Contact search: principal={}, skip={}, limit={}, hits={}",
                principal.getId(), skip, limit, result.size());
        }
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Contact> findById(Long id, Principal principal) {
        Optional<Contact> result = contacts.findOwned(id, principal.getId());
        if (result.isEmpty()) {
            log.debug("Contact not found or not owned: id={}, principal={}", id, principal.getId());
        }
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmailOrPhone(String email, String phone, Principal principal) {
        return contacts.existsOwnedByEmailOrPhone(principal.getId(), email, phone);
    }

    @Override
    @Transactional
    public Contact create(ContactDraft draft, Principal principal) {
        UserAccount owner = entityManager.getReference(UserAccount.class, principal.getId());
        Contact contact = Contact.create(owner, draft);
        Contact saved = persist(contact, draft.email(), draft.phone());
        log.info("Contact created: id={}, principal={}", saved.getId(), principal.getId());
        return saved;
    }

    @Override
    @Transactional
    public Optional<Contact> update(Long id, ContactPatch patch, Principal principal) {
        Optional<Contact> existing = contacts.findOwned(id, principal.getId());
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Contact contact = existing.get();
        contact.apply(patch);
        Contact saved = persist(contact, contact.getEmail(), contact.getPhone());
        log.info("Contact updated: id={}, principal={}", id, principal.getId());
        return Optional.of(saved);
    }

    @Override
    @Transactional
    public Optional<Contact> delete(Long id, Principal principal) {
        Optional<Contact> existing = contacts.findOwned(id, principal.getId());
        existing.ifPresent(contact -> {
            contacts.delete(contact);
            contacts.flush();
            log.warn("Contact deleted: id={}, principal={}", id, principal.getId());
        });
        return existing;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Contact> upcomingBirthdays(int windowDays, LocalDate today, Principal principal) {
        BirthdayWindow window = BirthdayWindow.starting(today, windowDays);

        String jpql = "SELECT c FROM Contact c WHERE c.owner.id = :ownerId";
        if (!window.coversWholeYear()) {
            String range = window.wraps()
                ? MONTH_DAY_KEY + " >= :startKey OR " + MONTH_DAY_KEY + " <= :endKey"
                : MONTH_DAY_KEY + " BETWEEN :startKey AND :endKey";
            if (window.observesLeapDay()) {
                range += " OR " + MONTH_DAY_KEY + " = " + BirthdayWindow.LEAP_DAY_KEY;
            }
            jpql += " AND (" + range + ")";
        }

        TypedQuery<Contact> query = entityManager.createQuery(jpql, Contact.class)
            .setParameter("ownerId", principal.getId());
        if (!window.coversWholeYear()) {
            query.setParameter("startKey", window.startKey())
                .setParameter("endKey", window.endKey());
        }

        List<Contact> result = new ArrayList<>(query.getResultList());
        result.sort(window.order());
        log.debug("Upcoming birthdays: principal={}, window={}, hits={}",
            principal.getId(), window, result.size());
        return result;
    }

    private Contact persist(Contact contact, String email, String phone) {
        try {
            return contacts.saveAndFlush(contact);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(
                "Contact with '" + email + "' email or '" + phone + "' phone number already exists.", e);
        }
    }
}
