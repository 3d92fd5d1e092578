package com.contactbook.infrastructure.avatar;

import java.util.Optional;

/**
 * Suggests a default avatar for a newly registered email.
 */
public interface AvatarProvider {

    Optional<String> avatarFor(String email);
}
