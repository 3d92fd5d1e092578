package com.contactbook.infrastructure.security;

import com.contactbook.application.exceptions.InvalidTokenException;
import com.contactbook.config.AuthProperties;
import com.contactbook.config.JwtConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenService Unit Tests")
class TokenServiceTest {

    private static final String SECRET = "unit-test-secret";

    private final JwtConfiguration jwtConfiguration = new JwtConfiguration();
    private final Clock systemClock = Clock.systemUTC();

    private AuthProperties properties;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        properties = new AuthProperties();
        properties.setJwtSecret(SECRET);
        tokenService = tokenService(properties, systemClock, systemClock);
    }

    private TokenService tokenService(AuthProperties props, Clock mintClock, Clock verifyClock) {
        MacAlgorithm algorithm = jwtConfiguration.macAlgorithm(props);
        return new TokenService(
            jwtConfiguration.jwtEncoder(props, algorithm),
            jwtConfiguration.jwtDecoder(props, algorithm, verifyClock),
            algorithm,
            props,
            mintClock);
    }

    @Nested
    @DisplayName("mint / verify")
    class MintAndVerify {

        @Test
        @DisplayName("Should round-trip claims and stamp iat and exp")
        void roundTrip() {
            String token = tokenService.mint(Map.of("sub", "alice", "scope", "access"), Duration.ofMinutes(10));

            Map<String, Object> claims = tokenService.verify(token, TokenPurpose.SESSION);

            assertThat(claims).containsEntry("sub", "alice").containsEntry("scope", "access");
            Instant iat = (Instant) claims.get("iat");
            Instant exp = (Instant) claims.get("exp");
            assertThat(Duration.between(iat, exp)).isEqualTo(Duration.ofMinutes(10));
        }

        @Test
        @DisplayName("Should reject an expired token")
        void rejectsExpired() {
            Clock twoHoursAgo = Clock.fixed(Instant.now().minus(Duration.ofHours(2)), ZoneOffset.UTC);
            TokenService pastMinter = tokenService(properties, twoHoursAgo, systemClock);
            String token = pastMinter.mint(Map.of("sub", "alice", "scope", "access"), Duration.ofHours(1));

            assertThatThrownBy(() -> tokenService.verify(token, TokenPurpose.SESSION))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessage("Could not validate credentials");
        }

        @Test
        @DisplayName("Should reject a token with a tampered payload")
        void rejectsTampered() {
            String token = tokenService.issueSessionToken("alice");
            String forged = tokenService.issueSessionToken("mallory");
            String[] original = token.split("\\.");
            String[] other = forged.split("\\.");
            String tampered = original[0] + "." + other[1] + "." + original[2];

            assertThatThrownBy(() -> tokenService.verify(tampered, TokenPurpose.SESSION))
                .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("Should reject a token signed with another secret")
        void rejectsForeignSecret() {
            AuthProperties other = new AuthProperties();
            other.setJwtSecret("some-other-secret");
            String token = tokenService(other, systemClock, systemClock).issueSessionToken("alice");

            assertThatThrownBy(() -> tokenService.readSession(token))
                .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("Should reject garbage, blank and null tokens")
        void rejectsGarbage() {
            assertThatThrownBy(() -> tokenService.verify("not-a-jwt", TokenPurpose.SESSION))
                .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> tokenService.verify(" ", TokenPurpose.SESSION))
                .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> tokenService.verify(null, TokenPurpose.SESSION))
                .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("Should sign with HS512 when configured")
        void supportsHs512() {
            AuthProperties hs512 = new AuthProperties();
            hs512.setJwtSecret(SECRET);
            hs512.setJwtAlgorithm("HS512");
            TokenService service = tokenService(hs512, systemClock, systemClock);

            assertThat(service.readSession(service.issueSessionToken("alice")).username()).isEqualTo("alice");
        }
    }

    @Nested
    @DisplayName("Variant reading")
    class Variants {

        @Test
        @DisplayName("Should read back each variant")
        void readsVariants() {
            assertThat(tokenService.readSession(tokenService.issueSessionToken("alice")).username())
                .isEqualTo("alice");
            assertThat(tokenService.readConfirmation(tokenService.issueConfirmationToken("alice@x.com")).email())
                .isEqualTo("alice@x.com");

            TokenClaims.PasswordReset reset =
                tokenService.readPasswordReset(tokenService.issuePasswordResetToken("alice@x.com", "$2a$hash"));
            assertThat(reset.email()).isEqualTo("alice@x.com");
            assertThat(reset.passwordHash()).isEqualTo("$2a$hash");
        }

        @Test
        @DisplayName("Should refuse a reset token as a session token")
        void resetTokenIsNotASession() {
            String reset = tokenService.issuePasswordResetToken("alice@x.com", "$2a$hash");

            assertThatThrownBy(() -> tokenService.readSession(reset))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                    e -> assertThat(e.getPurpose()).isEqualTo(TokenPurpose.SESSION));
        }

        @Test
        @DisplayName("Should refuse a session token as a confirmation token")
        void sessionTokenIsNotAConfirmation() {
            String session = tokenService.issueSessionToken("victim@x.com");

            assertThatThrownBy(() -> tokenService.readConfirmation(session))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                    e -> assertThat(e.getPurpose()).isEqualTo(TokenPurpose.EMAIL_CONFIRMATION));
        }

        @Test
        @DisplayName("Should refuse a confirmation token as a session token")
        void confirmationTokenIsNotASession() {
            String confirmation = tokenService.issueConfirmationToken("same@x.com");

            assertThatThrownBy(() -> tokenService.readSession(confirmation))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                    e -> assertThat(e.getPurpose()).isEqualTo(TokenPurpose.SESSION));
        }

        @Test
        @DisplayName("Should refuse a token without a scope")
        void unscopedTokenRejected() {
            String unscoped = tokenService.mint(Map.of("sub", "alice"), Duration.ofMinutes(5));

            assertThatThrownBy(() -> tokenService.readSession(unscoped))
                .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> tokenService.readConfirmation(unscoped))
                .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("Should refuse a confirmation token as a reset token")
        void confirmationTokenIsNotAReset() {
            String confirmation = tokenService.issueConfirmationToken("alice@x.com");

            assertThatThrownBy(() -> tokenService.readPasswordReset(confirmation))
                .isInstanceOfSatisfying(InvalidTokenException.class, e -> {
                    assertThat(e.getPurpose()).isEqualTo(TokenPurpose.PASSWORD_RESET);
                    assertThat(e.getMessage()).isEqualTo("Invalid or expired token");
                });
        }

        @Test
        @DisplayName("Should tag confirmation failures with the confirmation purpose")
        void confirmationFailureTagged() {
            String noSubject = tokenService.mint(Map.of("scope", "email_confirm"), Duration.ofMinutes(5));

            assertThatThrownBy(() -> tokenService.readConfirmation(noSubject))
                .isInstanceOfSatisfying(InvalidTokenException.class, e -> {
                    assertThat(e.getPurpose()).isEqualTo(TokenPurpose.EMAIL_CONFIRMATION);
                    assertThat(e.getMessage()).isEqualTo("Invalid email verification token");
                });
        }

        @Test
        @DisplayName("Should give session tokens the configured lifetime")
        void sessionLifetime() {
            properties.setSessionTokenTtl(Duration.ofSeconds(90));
            Map<String, Object> claims =
                tokenService.verify(tokenService.issueSessionToken("alice"), TokenPurpose.SESSION);

            assertThat(Duration.between((Instant) claims.get("iat"), (Instant) claims.get("exp")))
                .isEqualTo(Duration.ofSeconds(90));
        }
    }

    @Test
    @DisplayName("Should fail fast on a blank secret")
    void blankSecretFailsStartup() {
        AuthProperties blank = new AuthProperties();
        blank.setJwtSecret("  ");

        assertThatThrownBy(() -> jwtConfiguration.jwtEncoder(blank, MacAlgorithm.HS256))
            .isInstanceOf(IllegalStateException.class);
    }
}
