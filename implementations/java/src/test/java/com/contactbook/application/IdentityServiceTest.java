package com.contactbook.application;

import com.contactbook.application.exceptions.ForbiddenException;
import com.contactbook.application.exceptions.InvalidTokenException;
import com.contactbook.application.exceptions.UnauthenticatedException;
import com.contactbook.domain.model.Principal;
import com.contactbook.domain.model.UserRole;
import com.contactbook.infrastructure.security.TokenClaims;
import com.contactbook.infrastructure.security.TokenPurpose;
import com.contactbook.infrastructure.security.TokenService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("IdentityService Unit Tests")
class IdentityServiceTest {

    @Mock
    private TokenService tokenService;

    @Mock
    private PrincipalLookup principalLookup;

    @InjectMocks
    private IdentityService identityService;

    private static Principal principal(UserRole role) {
        return Principal.builder().id(1L).username("alice").email("alice@x.com").role(role).confirmed(true).build();
    }

    @Nested
    @DisplayName("resolvePrincipal Tests")
    class ResolvePrincipalTests {

        @Test
        @DisplayName("Should resolve the user named by a valid session token")
        void resolvesUser() {
            // Arrange
            when(tokenService.readSession("tok")).thenReturn(new TokenClaims.Session("alice"));
            when(principalLookup.findByUsername("alice")).thenReturn(Optional.of(principal(UserRole.USER)));

            // Act
            Principal result = identityService.resolvePrincipal("tok");

            // Assert
            assertThat(result.getUsername()).isEqualTo("alice");
        }

        @Test
        @DisplayName("Should turn an invalid token into an authentication failure")
        void invalidToken() {
            when(tokenService.readSession("bad")).thenThrow(new InvalidTokenException(TokenPurpose.SESSION));

            assertThatThrownBy(() -> identityService.resolvePrincipal("bad"))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Could not validate credentials");
            verify(principalLookup, never()).findByUsername(any());
        }

        @Test
        @DisplayName("Should fail when the token names an unknown user")
        void unknownUser() {
            when(tokenService.readSession("tok")).thenReturn(new TokenClaims.Session("ghost"));
            when(principalLookup.findByUsername("ghost")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> identityService.resolvePrincipal("tok"))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Could not validate credentials");
        }
    }

    @Nested
    @DisplayName("requireAdmin Tests")
    class RequireAdminTests {

        @Test
        @DisplayName("Should pass an administrator through")
        void admin() {
            Principal admin = principal(UserRole.ADMIN);

            assertThat(identityService.requireAdmin(admin)).isSameAs(admin);
        }

        @Test
        @DisplayName("Should forbid a regular user")
        void regularUser() {
            assertThatThrownBy(() -> identityService.requireAdmin(principal(UserRole.USER)))
                .isInstanceOf(ForbiddenException.class);
        }
    }
}
