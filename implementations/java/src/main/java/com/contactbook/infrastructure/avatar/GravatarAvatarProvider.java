package com.contactbook.infrastructure.avatar;

import com.contactbook.config.AvatarProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Gravatar URL derived from the MD5 of the trimmed, lower-cased email.
 */
@Component
@RequiredArgsConstructor
public class GravatarAvatarProvider implements AvatarProvider {

    private final AvatarProperties properties;

    @Override
    public Optional<String> avatarFor(String email) {
        if (!properties.getGravatar().isEnabled() || email == null || email.isBlank()) {
            return Optional.empty();
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        String hash = DigestUtils.md5DigestAsHex(normalized.getBytes(StandardCharsets.UTF_8));
        return Optional.of(properties.getGravatar().getBaseUrl() + hash);
    }
}
