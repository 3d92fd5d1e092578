package com.contactbook.infrastructure.security;

import com.contactbook.application.exceptions.InvalidTokenException;
import com.contactbook.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Mints and verifies the signed tokens used for sessions, email confirmation and
 * password reset.
 *
 * <p>Every token carries {@code iat} and {@code exp}; verification checks signature and
 * expiry only. The {@code read*} methods additionally require the exact claim shape of
 * their variant, so a token minted for one purpose is rejected for the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenService {

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final MacAlgorithm macAlgorithm;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * Sign the claims with {@code iat = now} and {@code exp = now + lifetime}.
     */
    public String mint(Map<String, Object> claims, Duration lifetime) {
        Instant now = clock.instant();
        JwtClaimsSet claimsSet = JwtClaimsSet.builder()
            .claims(c -> c.putAll(claims))
            .issuedAt(now)
            .expiresAt(now.plus(lifetime))
            .build();

        return jwtEncoder.encode(
            JwtEncoderParameters.from(JwsHeader.with(macAlgorithm).build(), claimsSet)
        ).getTokenValue();
    }

    /**
     * Verify signature, expiry and that the token was minted for {@code purpose}.
     *
     * @param token compact JWS
     * @param purpose what the token is being presented for
     * @return all claims of the token
     * @throws InvalidTokenException for any verification failure
     */
    public Map<String, Object> verify(String token, TokenPurpose purpose) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(purpose);
        }
        Map<String, Object> claims;
        try {
            claims = jwtDecoder.decode(token).getClaims();
        } catch (JwtException e) {
            log.debug("{} token rejected: {}", purpose, e.getMessage());
            throw new InvalidTokenException(purpose);
        }
        if (!purpose.getScope().equals(claims.get(TokenClaims.SCOPE))) {
            log.debug("{} token rejected: scope {}", purpose, claims.get(TokenClaims.SCOPE));
            throw new InvalidTokenException(purpose);
        }
        return claims;
    }

    public String issue(TokenClaims claims) {
        return mint(claims.toClaims(), lifetimeOf(claims));
    }

    public String issueSessionToken(String username) {
        return issue(new TokenClaims.Session(username));
    }

    public String issueConfirmationToken(String email) {
        return issue(new TokenClaims.Confirmation(email));
    }

    public String issuePasswordResetToken(String email, String passwordHash) {
        return issue(new TokenClaims.PasswordReset(email, passwordHash));
    }

    public TokenClaims.Session readSession(String token) {
        Map<String, Object> claims = verify(token, TokenPurpose.SESSION);
        return new TokenClaims.Session(subjectOnly(claims, TokenPurpose.SESSION));
    }

    public TokenClaims.Confirmation readConfirmation(String token) {
        Map<String, Object> claims = verify(token, TokenPurpose.EMAIL_CONFIRMATION);
        return new TokenClaims.Confirmation(subjectOnly(claims, TokenPurpose.EMAIL_CONFIRMATION));
    }

    public TokenClaims.PasswordReset readPasswordReset(String token) {
        Map<String, Object> claims = verify(token, TokenPurpose.PASSWORD_RESET);
        String email = stringClaim(claims, TokenClaims.SUBJECT);
        String passwordHash = stringClaim(claims, TokenClaims.PASSWORD);
        if (email == null || passwordHash == null) {
            log.debug("Password reset token is missing required claims");
            throw new InvalidTokenException(TokenPurpose.PASSWORD_RESET);
        }
        return new TokenClaims.PasswordReset(email, passwordHash);
    }

    private Duration lifetimeOf(TokenClaims claims) {
        switch (claims.purpose()) {
            case SESSION:
                return properties.getSessionTokenTtl();
            case EMAIL_CONFIRMATION:
                return properties.getConfirmationTokenTtl();
            default:
                return properties.getPasswordResetTokenTtl();
        }
    }

    private static String subjectOnly(Map<String, Object> claims, TokenPurpose purpose) {
        String subject = stringClaim(claims, TokenClaims.SUBJECT);
        if (subject == null || claims.containsKey(TokenClaims.PASSWORD)) {
            log.debug("{} token has the wrong claim shape", purpose);
            throw new InvalidTokenException(purpose);
        }
        return subject;
    }

    private static String stringClaim(Map<String, Object> claims, String name) {
        Object value = claims.get(name);
        if (value instanceof String s && !s.isBlank()) {
            return s;
        }
        return null;
    }
}
