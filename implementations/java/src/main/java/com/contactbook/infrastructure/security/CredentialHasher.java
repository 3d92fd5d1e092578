package com.contactbook.infrastructure.security;

import com.contactbook.application.exceptions.CorruptCredentialException;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * One-way password hashing backed by BCrypt.
 *
 * <p>{@link #verify} separates "wrong password" ({@code false}) from "stored digest is
 * unusable" ({@link CorruptCredentialException}); the plain {@link PasswordEncoder}
 * would report both as a mismatch.
 */
@Component
@RequiredArgsConstructor
public class CredentialHasher {

    private static final Pattern BCRYPT_DIGEST = Pattern.compile("\\A\\$2(a|y|b)?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    /**
     * BCrypt ignores input past this many bytes.
     */
    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;

    /**
     * @throws IllegalArgumentException if the password is null or longer than
     *         {@value #MAX_PASSWORD_BYTES} UTF-8 bytes
     */
    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Password must not be null");
        }
        if (tooLong(plaintext)) {
            throw new IllegalArgumentException("Password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return passwordEncoder.encode(plaintext);
    }

    /**
     * @param plaintext candidate password
     * @param digest stored digest
     * @return whether the password matches the digest
     * @throws CorruptCredentialException if the digest is not a BCrypt hash
     */
    public boolean verify(String plaintext, String digest) {
        if (digest == null || !BCRYPT_DIGEST.matcher(digest).matches()) {
            throw new CorruptCredentialException("Stored password digest is malformed");
        }
        if (plaintext == null || tooLong(plaintext)) {
            return false;
        }
        return passwordEncoder.matches(plaintext, digest);
    }

    private static boolean tooLong(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
