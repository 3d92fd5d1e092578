package com.contactbook.config;

import com.cloudinary.Cloudinary;
import com.cloudinary.utils.ObjectUtils;
import com.contactbook.infrastructure.avatar.AvatarStorage;
import com.contactbook.infrastructure.avatar.CloudinaryAvatarStorage;
import com.contactbook.infrastructure.avatar.UnavailableAvatarStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Chooses the avatar image host: Cloudinary when a cloud name is configured,
 * otherwise a storage that refuses every upload.
 */
@Configuration
@Slf4j
public class AvatarStorageConfiguration {

    @Bean
    public AvatarStorage avatarStorage(AvatarProperties properties) {
        AvatarProperties.Cloudinary settings = properties.getCloudinary();
        if (!StringUtils.hasText(settings.getCloudName())) {
            log.warn("contactbook.avatar.cloudinary.cloud-name is not set; avatar uploads are disabled");
            return new UnavailableAvatarStorage();
        }

        Cloudinary cloudinary = new Cloudinary(ObjectUtils.asMap(
            "cloud_name", settings.getCloudName(),
            "api_key", settings.getApiKey(),
            "api_secret", settings.getApiSecret(),
            "secure", true));

        log.info("Avatar uploads go to Cloudinary cloud {}", settings.getCloudName());
        return new CloudinaryAvatarStorage(cloudinary, settings);
    }
}
