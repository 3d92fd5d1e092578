package com.contactbook.infrastructure.cache;

import com.contactbook.application.PrincipalLookup;
import com.contactbook.domain.model.Principal;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed decorator over another {@link PrincipalLookup}.
 *
 * <p>Entries expire a fixed time after being written and are never invalidated on
 * directory writes, so a confirmation or avatar change becomes visible to
 * authentication within one TTL. Unknown usernames are not cached.
 */
@Slf4j
public class CachingPrincipalLookup implements PrincipalLookup {

    private final PrincipalLookup delegate;
    private final Cache<String, Principal> cache;

    public CachingPrincipalLookup(PrincipalLookup delegate, Duration ttl, long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
        log.info("Identity cache configured: ttl={}, maximumSize={}", ttl, maximumSize);
    }

    @Override
    public Optional<Principal> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        Principal cached = cache.getIfPresent(username);
        if (cached != null) {
            return Optional.of(cached);
        }

        Optional<Principal> loaded = delegate.findByUsername(username);
        loaded.ifPresent(principal -> cache.put(username, principal));
        return loaded;
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
