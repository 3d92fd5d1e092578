package com.contactbook.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Contact owned by exactly one user.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Every contact has an owner; deleting the owner cascades to its contacts</li>
 *   <li>Email and phone are unique within one owner's contacts, not globally</li>
 *   <li>A contact is never visible to, or mutable by, anyone but its owner</li>
 * </ul>
 */
@Entity
@Table(name = "contacts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_contacts_owner_email", columnNames = {"user_id", "email"}),
    @UniqueConstraint(name = "uk_contacts_owner_phone", columnNames = {"user_id", "phone"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class Contact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private UserAccount owner;

    @Column(name = "name", nullable = false, length = 50)
    private String name;

    @Column(name = "surname", nullable = false, length = 50)
    private String surname;

    @Column(name = "email", nullable = false, length = 100)
    private String email;

    @Column(name = "phone", nullable = false, length = 20)
    private String phone;

    @Column(name = "birthday", nullable = false)
    private LocalDate birthday;

    @Column(name = "info", length = 500)
    private String info;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private Contact(UserAccount owner, ContactDraft draft) {
        this.owner = owner;
        this.name = draft.name();
        this.surname = draft.surname();
        this.email = draft.email();
        this.phone = draft.phone();
        this.birthday = draft.birthday();
        this.info = draft.info();
    }

    /**
     * Factory method to create a new contact for an owner.
     *
     * @param owner owning user (managed reference)
     * @param draft validated contact data
     * @return transient contact ready to persist
     */
    public static Contact create(UserAccount owner, ContactDraft draft) {
        return new Contact(owner, draft);
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Overwrite only the fields present in the patch.
     */
    public void apply(ContactPatch patch) {
        if (patch.name() != null) {
            this.name = patch.name();
        }
        if (patch.surname() != null) {
            this.surname = patch.surname();
        }
        if (patch.email() != null) {
            this.email = patch.email();
        }
        if (patch.phone() != null) {
            this.phone = patch.phone();
        }
        if (patch.birthday() != null) {
            this.birthday = patch.birthday();
        }
        if (patch.info() != null) {
            this.info = patch.info();
        }
    }
}
