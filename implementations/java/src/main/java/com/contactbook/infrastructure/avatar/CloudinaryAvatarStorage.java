package com.contactbook.infrastructure.avatar;

import com.cloudinary.Cloudinary;
import com.cloudinary.Transformation;
import com.cloudinary.utils.ObjectUtils;
import com.contactbook.application.exceptions.ExternalServiceException;
import com.contactbook.config.AvatarProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Avatar uploads through the Cloudinary SDK.
 *
 * <p>Images are stored under {@code <folder>/<username>}, overwriting the previous one.
 * The returned URL is a square-cropped delivery URL pinned to the uploaded version.
 */
@Slf4j
public class CloudinaryAvatarStorage implements AvatarStorage {

    private final Cloudinary cloudinary;
    private final AvatarProperties.Cloudinary properties;

    public CloudinaryAvatarStorage(Cloudinary cloudinary, AvatarProperties.Cloudinary properties) {
        this.cloudinary = cloudinary;
        this.properties = properties;
    }

    @Override
    public String upload(InputStream image, String publicId) {
        String fullId = properties.getFolder() + "/" + publicId;

        Map<?, ?> response;
        try {
            response = cloudinary.uploader().upload(image.readAllBytes(),
                ObjectUtils.asMap("public_id", fullId, "overwrite", true));
        } catch (IOException | RuntimeException e) {
            log.error("Avatar upload failed: publicId={}", fullId, e);
            throw new ExternalServiceException("Avatar upload failed", e);
        }

        Object version = (response != null) ? response.get("version") : null;
        if (version == null) {
            throw new ExternalServiceException("Avatar host returned no version for " + fullId);
        }

        int size = properties.getSize();
        String url = cloudinary.url()
            .transformation(new Transformation().width(size).height(size).crop("fill"))
            .version(version)
            .generate(fullId);
        log.info("Avatar uploaded: publicId={}", fullId);
        return url;
    }
}
