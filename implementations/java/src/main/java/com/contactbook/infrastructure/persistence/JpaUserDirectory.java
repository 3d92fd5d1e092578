package com.contactbook.infrastructure.persistence;

import com.contactbook.application.exceptions.ConflictException;
import com.contactbook.application.exceptions.NotFoundException;
import com.contactbook.domain.model.UserAccount;
import com.contactbook.domain.repository.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

import static com.contactbook.infrastructure.logging.LogMasking.maskEmail;

/**
 * Adapter implementing {@link UserDirectory} on Spring Data JPA.
 *
 * Responsibilities:
 * - One transaction per mutation, flushed so constraint violations surface here
 * - Translate unique-constraint violations into {@link ConflictException}
 * - Log account lifecycle events with masked emails
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaUserDirectory implements UserDirectory {

    private final SpringDataUserRepository users;

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findById(Long id) {
        return users.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findByUsername(String username) {
        return users.findByUsername(username);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findByEmail(String email) {
        return users.findByEmail(email);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return users.existsByUsername(username);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return users.existsByEmail(email);
    }

    @Override
    @Transactional
    public UserAccount create(NewUser user, String avatarUrl) {
        UserAccount account = UserAccount.register(
            user.username(), user.email(), user.passwordHash(), user.role(), avatarUrl);
        try {
            UserAccount saved = users.saveAndFlush(account);
            log.info("User registered: id={}, username={}, email={}",
                saved.getId(), saved.getUsername(), maskEmail(saved.getEmail()));
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("User registration lost a uniqueness race: username={}", user.username());
            throw new ConflictException(conflictMessage(e), e);
        }
    }

    @Override
    @Transactional
    public void confirmEmail(String email) {
        UserAccount account = requireByEmail(email);
        if (account.isConfirmed()) {
            return;
        }
        account.confirmEmail();
        users.saveAndFlush(account);
        log.info("Email confirmed: userId={}", account.getId());
    }

    @Override
    @Transactional
    public UserAccount updateAvatar(String email, String avatarUrl) {
        UserAccount account = requireByEmail(email);
        account.changeAvatar(avatarUrl);
        UserAccount saved = users.saveAndFlush(account);
        log.info("Avatar updated: userId={}", saved.getId());
        return saved;
    }

    @Override
    @Transactional
    public UserAccount updatePasswordHash(Long userId, String passwordHash) {
        UserAccount account = users.findById(userId)
            .orElseThrow(() -> new NotFoundException("User not found"));
        account.changePasswordHash(passwordHash);
        UserAccount saved = users.saveAndFlush(account);
        log.info("Password changed: userId={}", saved.getId());
        return saved;
    }

    private UserAccount requireByEmail(String email) {
        return users.findByEmail(email)
            .orElseThrow(() -> new NotFoundException("User with this email was not found"));
    }

    private static String conflictMessage(DataIntegrityViolationException e) {
        String detail = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase();
        if (detail.contains("uk_users_email")) {
            return "User with this email already exists";
        }
        return "User with this username already exists";
    }
}
