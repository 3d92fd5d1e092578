package com.contactbook.domain.repository;

import com.contactbook.domain.model.UserAccount;
import com.contactbook.domain.model.UserRole;

import java.util.Optional;

/**
 * Repository interface for registered users.
 *
 * <p>Implementations must enforce:
 * <ul>
 *   <li>Global uniqueness of username and email at the storage layer</li>
 *   <li>One transaction per mutation, returning the refreshed record</li>
 *   <li>Lookups that report absence as an empty result, never as an exception</li>
 * </ul>
 */
public interface UserDirectory {

    Optional<UserAccount> findById(Long id);

    Optional<UserAccount> findByUsername(String username);

    Optional<UserAccount> findByEmail(String email);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    /**
     * Persist a new unconfirmed user.
     *
     * @param user registration data with an already hashed password
     * @param avatarUrl optional avatar URL
     * @return the stored user
     * @throws com.contactbook.application.exceptions.ConflictException if the username or
     *         email was taken concurrently
     */
    UserAccount create(NewUser user, String avatarUrl);

    /**
     * Mark the user's email as confirmed. Confirming an already confirmed user succeeds
     * without change.
     *
     * @param email email of the user
     * @throws com.contactbook.application.exceptions.NotFoundException if no user has that email
     */
    void confirmEmail(String email);

    /**
     * @param email email of the user
     * @param avatarUrl new avatar URL
     * @return the refreshed user
     */
    UserAccount updateAvatar(String email, String avatarUrl);

    /**
     * @param userId id of the user
     * @param passwordHash new password digest
     * @return the refreshed user
     */
    UserAccount updatePasswordHash(Long userId, String passwordHash);

    /**
     * Registration data with the password already hashed.
     */
    record NewUser(String username, String email, String passwordHash, UserRole role) {}
}
