package com.contactbook.config;

import com.contactbook.application.DirectoryPrincipalLookup;
import com.contactbook.application.PrincipalLookup;
import com.contactbook.domain.repository.UserDirectory;
import com.contactbook.infrastructure.cache.CachingPrincipalLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caching configuration with Caffeine.
 *
 * Only principal lookups are cached. Every authenticated request resolves its bearer
 * token to a user, so without the cache each request costs one extra query.
 *
 * Security:
 * - Entries expire after {@code contactbook.auth.identity-cache-ttl}
 * - Unknown usernames are never cached
 * - Cached values are detached {@code Principal} snapshots, never entities
 */
@Configuration
@Slf4j
public class CacheConfiguration {

    @Bean
    public PrincipalLookup principalLookup(UserDirectory userDirectory, AuthProperties properties) {
        PrincipalLookup direct = new DirectoryPrincipalLookup(userDirectory);
        if (properties.getIdentityCacheTtl().isZero()) {
            log.warn("Identity cache disabled (contactbook.auth.identity-cache-ttl=0)");
            return direct;
        }
        return new CachingPrincipalLookup(direct, properties.getIdentityCacheTtl(), properties.getIdentityCacheMaxSize());
    }
}
