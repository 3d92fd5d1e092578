package com.contactbook.infrastructure.avatar;

import java.io.InputStream;

/**
 * Image host for uploaded avatars.
 */
public interface AvatarStorage {

    /**
     * Upload an image, replacing any previous image under the same id.
     *
     * @param image image bytes
     * @param publicId stable id for the image, usually derived from the username
     * @return public URL of the stored image
     * @throws com.contactbook.application.exceptions.ExternalServiceException if the
     *         host rejects the upload or is unreachable
     */
    String upload(InputStream image, String publicId);
}
