package com.contactbook.infrastructure.security;

import com.contactbook.application.exceptions.CorruptCredentialException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CredentialHasher Unit Tests")
class CredentialHasherTest {

    private final CredentialHasher hasher = new CredentialHasher(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("Should verify the password a digest was made from")
    void verifiesOwnDigest() {
        String digest = hasher.hash("pw123");

        assertThat(digest).isNotEqualTo("pw123").startsWith("$2");
        assertThat(hasher.verify("pw123", digest)).isTrue();
    }

    @Test
    @DisplayName("Should reject a different password")
    void rejectsWrongPassword() {
        String digest = hasher.hash("pw123");

        assertThat(hasher.verify("pw124", digest)).isFalse();
        assertThat(hasher.verify(null, digest)).isFalse();
    }

    @Test
    @DisplayName("Should salt every digest")
    void saltsDigests() {
        assertThat(hasher.hash("same")).isNotEqualTo(hasher.hash("same"));
    }

    @Test
    @DisplayName("Should report a malformed stored digest as corrupt, not as a mismatch")
    void malformedDigestIsCorrupt() {
        assertThatThrownBy(() -> hasher.verify("pw123", "pw123"))
            .isInstanceOf(CorruptCredentialException.class);
        assertThatThrownBy(() -> hasher.verify("pw123", null))
            .isInstanceOf(CorruptCredentialException.class);
        assertThatThrownBy(() -> hasher.verify("pw123", "$2a$10$tooShort"))
            .isInstanceOf(CorruptCredentialException.class);
    }

    @Test
    @DisplayName("Should refuse passwords BCrypt would truncate")
    void refusesOverlongPasswords() {
        String base = "a".repeat(CredentialHasher.MAX_PASSWORD_BYTES);
        String digest = hasher.hash(base);

        assertThatThrownBy(() -> hasher.hash(base + "X")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hasher.hash("\u00e9".repeat(37))).isInstanceOf(IllegalArgumentException.class);
        assertThat(hasher.verify(base + "Y", digest)).isFalse();
        assertThat(hasher.verify(base, digest)).isTrue();
    }

    @Test
    @DisplayName("Should refuse to hash null")
    void refusesNull() {
        assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
