package com.contactbook.application;

import com.contactbook.application.exceptions.ForbiddenException;
import com.contactbook.application.exceptions.InvalidTokenException;
import com.contactbook.application.exceptions.UnauthenticatedException;
import com.contactbook.domain.model.Principal;
import com.contactbook.infrastructure.security.TokenClaims;
import com.contactbook.infrastructure.security.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a bearer token into the acting {@link Principal} and enforces role checks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityService {

    private final TokenService tokenService;
    private final PrincipalLookup principalLookup;

    /**
     * @param token session token from the {@code Authorization} header
     * @return the principal the token was issued to
     * @throws UnauthenticatedException if the token is invalid, expired, lacks a subject,
     *         or names a user that does not exist
     */
    public Principal resolvePrincipal(String token) {
        TokenClaims.Session session;
        try {
            session = tokenService.readSession(token);
        } catch (InvalidTokenException e) {
            throw new UnauthenticatedException(UnauthenticatedException.COULD_NOT_VALIDATE);
        }

        return principalLookup.findByUsername(session.username())
            .orElseThrow(() -> {
                log.warn("Session token names an unknown user: {}", session.username());
                return new UnauthenticatedException(UnauthenticatedException.COULD_NOT_VALIDATE);
            });
    }

    /**
     * @throws ForbiddenException if the principal is not an administrator
     */
    public Principal requireAdmin(Principal principal) {
        if (principal == null || !principal.isAdmin()) {
            log.warn("Admin operation denied: principal={}", principal == null ? null : principal.getId());
            throw new ForbiddenException("Insufficient access rights");
        }
        return principal;
    }
}
