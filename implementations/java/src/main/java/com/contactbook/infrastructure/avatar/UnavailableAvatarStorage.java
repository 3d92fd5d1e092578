package com.contactbook.infrastructure.avatar;

import com.contactbook.application.exceptions.ExternalServiceException;

import java.io.InputStream;

/**
 * Placeholder used when no image host is configured.
 */
public class UnavailableAvatarStorage implements AvatarStorage {

    @Override
    public String upload(InputStream image, String publicId) {
        throw new ExternalServiceException("Avatar storage is not configured");
    }
}
