package com.contactbook.config;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;

/**
 * Signing primitives shared by every token purpose: one HMAC key, one algorithm.
 */
@Configuration
@Slf4j
public class JwtConfiguration {

    private static final String KEY_ID = "contactbook-hmac";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public MacAlgorithm macAlgorithm(AuthProperties properties) {
        MacAlgorithm algorithm = MacAlgorithm.from(properties.getJwtAlgorithm());
        if (algorithm == null) {
            throw new IllegalStateException(
                "Unsupported contactbook.auth.jwt-algorithm: " + properties.getJwtAlgorithm());
        }
        log.info("Token signing algorithm: {}", algorithm.getName());
        return algorithm;
    }

    @Bean
    public JwtEncoder jwtEncoder(AuthProperties properties, MacAlgorithm macAlgorithm) {
        var jwk = new OctetSequenceKey.Builder(signingKey(properties.getJwtSecret(), macAlgorithm))
            .algorithm(JWSAlgorithm.parse(macAlgorithm.getName()))
            .keyID(KEY_ID)
            .build();

        JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
        return new NimbusJwtEncoder(jwkSource);
    }

    /**
     * Decoder that checks signature and expiry with no clock skew, against the same
     * clock used to mint tokens.
     */
    @Bean
    public JwtDecoder jwtDecoder(AuthProperties properties, MacAlgorithm macAlgorithm, Clock clock) {
        var key = new SecretKeySpec(signingKey(properties.getJwtSecret(), macAlgorithm), macAlgorithm.getName());
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(macAlgorithm).build();

        JwtTimestampValidator timestampValidator = new JwtTimestampValidator(Duration.ZERO);
        timestampValidator.setClock(clock);
        decoder.setJwtValidator(timestampValidator);
        return decoder;
    }

    /**
     * Derive a key of exactly the size the algorithm needs (32/48/64 bytes) from the
     * configured secret, so any non-blank secret works.
     */
    static byte[] signingKey(String secret, MacAlgorithm algorithm) {
        String s = (secret == null) ? "" : secret.trim();
        if (s.isEmpty()) {
            throw new IllegalStateException("contactbook.auth.jwt-secret is empty. Set CONTACTBOOK_JWT_SECRET.");
        }
        String digest = switch (algorithm) {
            case HS384 -> "SHA-384";
            case HS512 -> "SHA-512";
            default -> "SHA-256";
        };
        try {
            return MessageDigest.getInstance(digest).digest(s.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(digest + " not available", e);
        }
    }
}
