package com.contactbook.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Avatar settings bound from {@code contactbook.avatar.*}.
 */
@ConfigurationProperties(prefix = "contactbook.avatar")
@Getter
@Setter
@ToString
public class AvatarProperties {

    private final Gravatar gravatar = new Gravatar();

    private final Cloudinary cloudinary = new Cloudinary();

    @Getter
    @Setter
    @ToString
    public static class Gravatar {

        private boolean enabled = true;

        private String baseUrl = "https://www.gravatar.com/avatar/";
    }

    @Getter
    @Setter
    @ToString
    public static class Cloudinary {

        /**
         * Cloud name. Uploads are disabled while this is blank.
         */
        private String cloudName;

        private String apiKey;

        @ToString.Exclude
        private String apiSecret;

        /**
         * Folder prefix for public ids; the username is appended.
         */
        private String folder = "RestApp";

        private int size = 250;
    }
}
