package com.contactbook.application;

import com.contactbook.application.exceptions.ConflictException;
import com.contactbook.application.exceptions.EmailNotConfirmedException;
import com.contactbook.application.exceptions.NotFoundException;
import com.contactbook.application.exceptions.UnauthenticatedException;
import com.contactbook.application.exceptions.VerificationException;
import com.contactbook.domain.model.UserAccount;
import com.contactbook.domain.model.UserRole;
import com.contactbook.domain.repository.UserDirectory;
import com.contactbook.infrastructure.avatar.AvatarProvider;
import com.contactbook.infrastructure.mail.MailDispatcher;
import com.contactbook.infrastructure.security.CredentialHasher;
import com.contactbook.infrastructure.security.TokenClaims;
import com.contactbook.infrastructure.security.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

import static com.contactbook.infrastructure.logging.LogMasking.maskEmail;

/**
 * Account lifecycle: registration, login, email confirmation and password reset.
 *
 * <p>Accounts move from unregistered to registered-unconfirmed on sign-up and to
 * registered-confirmed once the emailed token is presented. Only confirmed accounts
 * can log in or reset their password.
 *
 * <p>A password reset never touches the stored hash until the reset token comes back:
 * the new password is hashed up front and carried inside the signed token.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthWorkflow {

    public static final String USERNAME_TAKEN = "User with this username already exists";
    public static final String EMAIL_TAKEN = "User with this email already exists";
    public static final String VERIFICATION_ERROR = "Verification error";
    public static final String ALREADY_CONFIRMED = "Your email address is already confirmed";
    public static final String EMAIL_CONFIRMED = "Email successfully confirmed";
    public static final String CHECK_EMAIL_CONFIRMATION = "Check your email for confirmation instructions";
    public static final String CHECK_EMAIL_RESET = "Check your email for password reset instructions";
    public static final String EMAIL_NOT_CONFIRMED = "Your email address is not confirmed";
    public static final String RESET_USER_NOT_FOUND = "User with this email was not found";
    public static final String PASSWORD_CHANGED = "Password has been successfully changed";

    private final UserDirectory userDirectory;
    private final CredentialHasher credentialHasher;
    private final TokenService tokenService;
    private final MailDispatcher mailDispatcher;
    private final AvatarProvider avatarProvider;

    /**
     * Create an unconfirmed account and email a confirmation link.
     *
     * @throws ConflictException if the username or the email is already registered
     */
    public UserAccount register(Registration registration) {
        if (userDirectory.existsByUsername(registration.username())) {
            throw new ConflictException(USERNAME_TAKEN);
        }
        if (userDirectory.existsByEmail(registration.email())) {
            throw new ConflictException(EMAIL_TAKEN);
        }

        String passwordHash = credentialHasher.hash(registration.password());
        UserAccount account = userDirectory.create(
            new UserDirectory.NewUser(registration.username(), registration.email(), passwordHash, UserRole.USER),
            resolveAvatar(registration.email()));

        mailDispatcher.sendConfirmation(account.getEmail(), account.getUsername());
        return account;
    }

    /**
     * @return a session token
     * @throws UnauthenticatedException for an unknown user or a wrong password
     * @throws EmailNotConfirmedException if the password is right but the email is not confirmed
     */
    public String login(String username, String password) {
        Optional<UserAccount> found = userDirectory.findByUsername(username);
        if (found.isEmpty() || !credentialHasher.verify(password, found.get().getPasswordHash())) {
            log.info("Login failed: username={}", username);
            throw new UnauthenticatedException(UnauthenticatedException.INVALID_CREDENTIALS);
        }

        UserAccount account = found.get();
        if (!account.isConfirmed()) {
            log.info("Login refused, email not confirmed: userId={}", account.getId());
            throw new EmailNotConfirmedException();
        }

        log.info("Login succeeded: userId={}", account.getId());
        return tokenService.issueSessionToken(account.getUsername());
    }

    /**
     * Apply an email-confirmation token. Confirming twice is harmless.
     *
     * @return client-facing status message
     * @throws VerificationException if the token's email has no account
     */
    public String confirmEmail(String token) {
        String email = tokenService.readConfirmation(token).email();

        UserAccount account = userDirectory.findByEmail(email)
            .orElseThrow(() -> new VerificationException(VERIFICATION_ERROR));
        if (account.isConfirmed()) {
            return ALREADY_CONFIRMED;
        }

        userDirectory.confirmEmail(email);
        return EMAIL_CONFIRMED;
    }

    /**
     * Re-send the confirmation link. Unknown emails get the same reply and no mail.
     */
    public String requestConfirmationEmail(String email) {
        Optional<UserAccount> found = userDirectory.findByEmail(email);
        if (found.isPresent() && found.get().isConfirmed()) {
            return ALREADY_CONFIRMED;
        }
        found.ifPresentOrElse(
            account -> mailDispatcher.sendConfirmation(account.getEmail(), account.getUsername()),
            () -> log.info("Confirmation re-send for unknown email {}", maskEmail(email)));
        return CHECK_EMAIL_CONFIRMATION;
    }

    /**
     * Start a password reset by emailing a token that carries the new password's hash.
     * Unknown emails get the same reply and no mail.
     *
     * @throws VerificationException if the account exists but is unconfirmed
     */
    public String requestPasswordReset(String email, String newPassword) {
        Optional<UserAccount> found = userDirectory.findByEmail(email);
        if (found.isEmpty()) {
            log.info("Password reset requested for unknown email {}", maskEmail(email));
            return CHECK_EMAIL_RESET;
        }

        UserAccount account = found.get();
        if (!account.isConfirmed()) {
            throw new VerificationException(EMAIL_NOT_CONFIRMED);
        }

        String passwordHash = credentialHasher.hash(newPassword);
        String resetToken = tokenService.issuePasswordResetToken(account.getEmail(), passwordHash);
        mailDispatcher.sendPasswordReset(account.getEmail(), account.getUsername(), resetToken);
        log.info("Password reset requested: userId={}", account.getId());
        return CHECK_EMAIL_RESET;
    }

    /**
     * Apply a password reset token: the hash it carries replaces the stored one.
     *
     * @throws NotFoundException if the token's email has no account
     */
    public String confirmPasswordReset(String token) {
        TokenClaims.PasswordReset reset = tokenService.readPasswordReset(token);

        UserAccount account = userDirectory.findByEmail(reset.email())
            .orElseThrow(() -> new NotFoundException(RESET_USER_NOT_FOUND));
        userDirectory.updatePasswordHash(account.getId(), reset.passwordHash());
        return PASSWORD_CHANGED;
    }

    private String resolveAvatar(String email) {
        try {
            return avatarProvider.avatarFor(email).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Avatar lookup failed for {}, registering without one", maskEmail(email), e);
            return null;
        }
    }
}
