package com.contactbook.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Authentication settings bound from {@code contactbook.auth.*}.
 */
@ConfigurationProperties(prefix = "contactbook.auth")
@Getter
@Setter
@ToString
public class AuthProperties {

    /**
     * Shared HMAC signing secret. Required.
     */
    @ToString.Exclude
    private String jwtSecret;

    /**
     * JWS algorithm: HS256, HS384 or HS512.
     */
    private String jwtAlgorithm = "HS256";

    /**
     * Session token lifetime; bare numbers are seconds.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration sessionTokenTtl = Duration.ofSeconds(3600);

    @DurationUnit(ChronoUnit.DAYS)
    private Duration confirmationTokenTtl = Duration.ofDays(7);

    @DurationUnit(ChronoUnit.DAYS)
    private Duration passwordResetTokenTtl = Duration.ofDays(7);

    /**
     * How long a resolved principal may be served from cache. Bounds how stale a
     * cached role or confirmation flag can be.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration identityCacheTtl = Duration.ofMinutes(5);

    private long identityCacheMaxSize = 10_000;
}
