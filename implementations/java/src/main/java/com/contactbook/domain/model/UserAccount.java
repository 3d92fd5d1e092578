package com.contactbook.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registered user of the contact book.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Username and email are each globally unique (enforced by the database)</li>
 *   <li>{@code passwordHash} is always a one-way digest, never the plaintext password</li>
 *   <li>Role is fixed at registration</li>
 * </ul>
 *
 * <p>Lifecycle: created unconfirmed by registration; later mutated only by email
 * confirmation, avatar update and password reset. Users are never hard-deleted.
 */
@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(name = "uk_users_username", columnNames = "username"),
    @UniqueConstraint(name = "uk_users_email", columnNames = "email")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class UserAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, length = 50)
    private String username;

    @Column(name = "email", nullable = false, length = 100)
    private String email;

    @Column(name = "hashed_password", nullable = false)
    private String passwordHash;

    @Column(name = "confirmed", nullable = false)
    private boolean confirmed;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, updatable = false, length = 16)
    private UserRole role;

    @Column(name = "avatar", length = 255)
    private String avatarUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private UserAccount(String username, String email, String passwordHash, UserRole role, String avatarUrl) {
        this.username = username;
        this.email = email;
        this.passwordHash = passwordHash;
        this.role = role;
        this.avatarUrl = avatarUrl;
        this.confirmed = false;
    }

    /**
     * Create a new, unconfirmed user.
     *
     * @param username unique username
     * @param email unique email
     * @param passwordHash already hashed password
     * @param role role, {@link UserRole#USER} when null
     * @param avatarUrl optional avatar URL
     * @return transient user ready to persist
     */
    public static UserAccount register(String username, String email, String passwordHash,
                                       UserRole role, String avatarUrl) {
        return new UserAccount(username, email, passwordHash,
            role != null ? role : UserRole.USER, avatarUrl);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Mark the email as confirmed. Confirming twice is a no-op.
     */
    public void confirmEmail() {
        this.confirmed = true;
    }

    public void changeAvatar(String avatarUrl) {
        this.avatarUrl = avatarUrl;
    }

    public void changePasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }
}
