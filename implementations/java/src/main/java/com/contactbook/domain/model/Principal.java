package com.contactbook.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable authenticated identity for a request.
 *
 * <p>Resolved from a bearer token at the API edge and passed explicitly into every
 * contact operation. It is a detached snapshot of a {@link UserAccount}, so it is safe
 * to cache and to share between threads.
 */
@Value
@Builder
public class Principal {
    Long id;
    String username;
    String email;
    UserRole role;
    boolean confirmed;
    String avatarUrl;
    Instant createdAt;

    public static Principal of(UserAccount user) {
        return Principal.builder()
            .id(user.getId())
            .username(user.getUsername())
            .email(user.getEmail())
            .role(user.getRole())
            .confirmed(user.isConfirmed())
            .avatarUrl(user.getAvatarUrl())
            .createdAt(user.getCreatedAt())
            .build();
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
