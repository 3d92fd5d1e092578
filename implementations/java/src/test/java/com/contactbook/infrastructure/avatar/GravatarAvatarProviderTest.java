package com.contactbook.infrastructure.avatar;

import com.contactbook.config.AvatarProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GravatarAvatarProvider Tests")
class GravatarAvatarProviderTest {

    @Test
    @DisplayName("Should hash the normalized email")
    void hashesNormalizedEmail() {
        GravatarAvatarProvider provider = new GravatarAvatarProvider(new AvatarProperties());

        assertThat(provider.avatarFor("  Alice@X.com "))
            .contains("https://www.gravatar.com/avatar/77df0c091681b71e32b643dc62e4a567");
    }

    @Test
    @DisplayName("Should return nothing when disabled")
    void disabled() {
        AvatarProperties properties = new AvatarProperties();
        properties.getGravatar().setEnabled(false);

        assertThat(new GravatarAvatarProvider(properties).avatarFor("alice@x.com")).isEmpty();
    }
}
