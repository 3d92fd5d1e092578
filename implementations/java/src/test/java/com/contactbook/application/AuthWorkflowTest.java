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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthWorkflow Unit Tests")
class AuthWorkflowTest {

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private CredentialHasher credentialHasher;

    @Mock
    private TokenService tokenService;

    @Mock
    private MailDispatcher mailDispatcher;

    @Mock
    private AvatarProvider avatarProvider;

    @InjectMocks
    private AuthWorkflow authWorkflow;

    private static UserAccount account(long id, boolean confirmed) {
        UserAccount account = UserAccount.register("alice", "alice@x.com", "$2a$stored", UserRole.USER, null);
        ReflectionTestUtils.setField(account, "id", id);
        if (confirmed) {
            account.confirmEmail();
        }
        return account;
    }

    @Nested
    @DisplayName("register Tests")
    class RegisterTests {

        private final Registration alice = new Registration("alice", "alice@x.com", "pw123");

        @Test
        @DisplayName("Should store a hashed password and send a confirmation email")
        void registers() {
            // Arrange
            when(userDirectory.existsByUsername("alice")).thenReturn(false);
            when(userDirectory.existsByEmail("alice@x.com")).thenReturn(false);
            when(credentialHasher.hash("pw123")).thenReturn("$2a$hashed");
            when(avatarProvider.avatarFor("alice@x.com")).thenReturn(Optional.of("https://avatar/alice"));
            when(userDirectory.create(any(), eq("https://avatar/alice"))).thenReturn(account(1L, false));

            // Act
            UserAccount result = authWorkflow.register(alice);

            // Assert
            ArgumentCaptor<UserDirectory.NewUser> captor = ArgumentCaptor.forClass(UserDirectory.NewUser.class);
            verify(userDirectory).create(captor.capture(), eq("https://avatar/alice"));
            assertThat(captor.getValue().passwordHash()).isEqualTo("$2a$hashed");
            assertThat(captor.getValue().role()).isEqualTo(UserRole.USER);
            assertThat(result.isConfirmed()).isFalse();
            verify(mailDispatcher).sendConfirmation("alice@x.com", "alice");
        }

        @Test
        @DisplayName("Should reject a taken username before checking the email")
        void usernameTaken() {
            when(userDirectory.existsByUsername("alice")).thenReturn(true);

            assertThatThrownBy(() -> authWorkflow.register(alice))
                .isInstanceOf(ConflictException.class)
                .hasMessage("User with this username already exists");
            verify(userDirectory, never()).existsByEmail(anyString());
            verify(userDirectory, never()).create(any(), any());
            verifyNoInteractions(mailDispatcher);
        }

        @Test
        @DisplayName("Should reject a taken email without writing")
        void emailTaken() {
            when(userDirectory.existsByUsername("alice")).thenReturn(false);
            when(userDirectory.existsByEmail("alice@x.com")).thenReturn(true);

            assertThatThrownBy(() -> authWorkflow.register(alice))
                .isInstanceOf(ConflictException.class)
                .hasMessage("User with this email already exists");
            verify(userDirectory, never()).create(any(), any());
        }

        @Test
        @DisplayName("Should register without an avatar when the provider fails")
        void avatarFailureTolerated() {
            when(userDirectory.existsByUsername("alice")).thenReturn(false);
            when(userDirectory.existsByEmail("alice@x.com")).thenReturn(false);
            when(credentialHasher.hash("pw123")).thenReturn("$2a$hashed");
            when(avatarProvider.avatarFor("alice@x.com")).thenThrow(new IllegalStateException("down"));
            when(userDirectory.create(any(), isNull())).thenReturn(account(1L, false));

            assertThat(authWorkflow.register(alice)).isNotNull();
        }
    }

    @Nested
    @DisplayName("login Tests")
    class LoginTests {

        @Test
        @DisplayName("Should issue a session token for a confirmed user")
        void logsIn() {
            when(userDirectory.findByUsername("alice")).thenReturn(Optional.of(account(1L, true)));
            when(credentialHasher.verify("pw123", "$2a$stored")).thenReturn(true);
            when(tokenService.issueSessionToken("alice")).thenReturn("session-token");

            assertThat(authWorkflow.login("alice", "pw123")).isEqualTo("session-token");
        }

        @Test
        @DisplayName("Should give the same answer for an unknown user and a wrong password")
        void invalidCredentials() {
            when(userDirectory.findByUsername("ghost")).thenReturn(Optional.empty());
            when(userDirectory.findByUsername("alice")).thenReturn(Optional.of(account(1L, true)));
            when(credentialHasher.verify("wrong", "$2a$stored")).thenReturn(false);

            assertThatThrownBy(() -> authWorkflow.login("ghost", "pw123"))
                .isExactlyInstanceOf(UnauthenticatedException.class)
                .hasMessage("Invalid username or password");
            assertThatThrownBy(() -> authWorkflow.login("alice", "wrong"))
                .isExactlyInstanceOf(UnauthenticatedException.class)
                .hasMessage("Invalid username or password");
        }

        @Test
        @DisplayName("Should tell an unconfirmed user with the right password to confirm first")
        void unconfirmed() {
            when(userDirectory.findByUsername("alice")).thenReturn(Optional.of(account(1L, false)));
            when(credentialHasher.verify("pw123", "$2a$stored")).thenReturn(true);

            assertThatThrownBy(() -> authWorkflow.login("alice", "pw123"))
                .isInstanceOf(EmailNotConfirmedException.class)
                .hasMessage("Email address not confirmed");
            verify(tokenService, never()).issueSessionToken(anyString());
        }
    }

    @Nested
    @DisplayName("confirmEmail Tests")
    class ConfirmEmailTests {

        @Test
        @DisplayName("Should confirm an unconfirmed account")
        void confirms() {
            when(tokenService.readConfirmation("tok")).thenReturn(new TokenClaims.Confirmation("alice@x.com"));
            when(userDirectory.findByEmail("alice@x.com")).thenReturn(Optional.of(account(1L, false)));

            assertThat(authWorkflow.confirmEmail("tok")).isEqualTo("Email successfully confirmed");
            verify(userDirectory).confirmEmail("alice@x.com");
        }

        @Test
        @DisplayName("Should leave an already confirmed account alone")
        void alreadyConfirmed() {
            when(tokenService.readConfirmation("tok")).thenReturn(new TokenClaims.Confirmation("alice@x.com"));
            when(userDirectory.findByEmail("alice@x.com")).thenReturn(Optional.of(account(1L, true)));

            assertThat(authWorkflow.confirmEmail("tok")).isEqualTo("Your email address is already confirmed");
            verify(userDirectory, never()).confirmEmail(anyString());
        }

        @Test
        @DisplayName("Should fail verification for an email with no account")
        void unknownEmail() {
            when(tokenService.readConfirmation("tok")).thenReturn(new TokenClaims.Confirmation("ghost@x.com"));
            when(userDirectory.findByEmail("ghost@x.com")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> authWorkflow.confirmEmail("tok"))
                .isInstanceOf(VerificationException.class)
                .hasMessage("Verification error");
        }
    }

    @Nested
    @DisplayName("Password reset Tests")
    class PasswordResetTests {

        @Test
        @DisplayName("Should mail a reset token carrying the new hash without touching the stored one")
        void requestsReset() {
            when(userDirectory.findByEmail("alice@x.com")).thenReturn(Optional.of(account(1L, true)));
            when(credentialHasher.hash("newpw")).thenReturn("$2a$new");
            when(tokenService.issuePasswordResetToken("alice@x.com", "$2a$new")).thenReturn("reset-token");

            String message = authWorkflow.requestPasswordReset("alice@x.com", "newpw");

            assertThat(message).isEqualTo("Check your email for password reset instructions");
            verify(mailDispatcher).sendPasswordReset("alice@x.com", "alice", "reset-token");
            verify(userDirectory, never()).updatePasswordHash(any(), anyString());
        }

        @Test
        @DisplayName("Should answer an unknown email identically and send nothing")
        void unknownEmail() {
            when(userDirectory.findByEmail("ghost@x.com")).thenReturn(Optional.empty());

            assertThat(authWorkflow.requestPasswordReset("ghost@x.com", "newpw"))
                .isEqualTo("Check your email for password reset instructions");
            verifyNoInteractions(mailDispatcher, tokenService, credentialHasher);
        }

        @Test
        @DisplayName("Should refuse an unconfirmed account")
        void unconfirmed() {
            when(userDirectory.findByEmail("alice@x.com")).thenReturn(Optional.of(account(1L, false)));

            assertThatThrownBy(() -> authWorkflow.requestPasswordReset("alice@x.com", "newpw"))
                .isInstanceOf(VerificationException.class)
                .hasMessage("Your email address is not confirmed");
            verifyNoInteractions(mailDispatcher);
        }

        @Test
        @DisplayName("Should store the hash carried by the reset token")
        void confirmsReset() {
            when(tokenService.readPasswordReset("tok"))
                .thenReturn(new TokenClaims.PasswordReset("alice@x.com", "$2a$new"));
            when(userDirectory.findByEmail("alice@x.com")).thenReturn(Optional.of(account(7L, true)));

            assertThat(authWorkflow.confirmPasswordReset("tok")).isEqualTo("Password has been successfully changed");
            verify(userDirectory).updatePasswordHash(7L, "$2a$new");
        }

        @Test
        @DisplayName("Should report a reset for a vanished account as not found")
        void resetForUnknownUser() {
            when(tokenService.readPasswordReset("tok"))
                .thenReturn(new TokenClaims.PasswordReset("ghost@x.com", "$2a$new"));
            when(userDirectory.findByEmail("ghost@x.com")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> authWorkflow.confirmPasswordReset("tok"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("User with this email was not found");
        }
    }

    @Nested
    @DisplayName("requestConfirmationEmail Tests")
    class RequestConfirmationEmailTests {

        @Test
        @DisplayName("Should re-send for an unconfirmed account")
        void resends() {
            when(userDirectory.findByEmail("alice@x.com")).thenReturn(Optional.of(account(1L, false)));

            assertThat(authWorkflow.requestConfirmationEmail("alice@x.com"))
                .isEqualTo("Check your email for confirmation instructions");
            verify(mailDispatcher).sendConfirmation("alice@x.com", "alice");
        }

        @Test
        @DisplayName("Should not mail an already confirmed account")
        void alreadyConfirmed() {
            when(userDirectory.findByEmail("alice@x.com")).thenReturn(Optional.of(account(1L, true)));

            assertThat(authWorkflow.requestConfirmationEmail("alice@x.com"))
                .isEqualTo("Your email address is already confirmed");
            verifyNoInteractions(mailDispatcher);
        }

        @Test
        @DisplayName("Should answer an unknown email the same and send nothing")
        void unknown() {
            when(userDirectory.findByEmail("ghost@x.com")).thenReturn(Optional.empty());

            assertThat(authWorkflow.requestConfirmationEmail("ghost@x.com"))
                .isEqualTo("Check your email for confirmation instructions");
            verifyNoInteractions(mailDispatcher);
        }
    }
}
