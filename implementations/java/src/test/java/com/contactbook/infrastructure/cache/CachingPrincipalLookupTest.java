package com.contactbook.infrastructure.cache;

import com.contactbook.application.PrincipalLookup;
import com.contactbook.domain.model.Principal;
import com.contactbook.domain.model.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CachingPrincipalLookup Unit Tests")
class CachingPrincipalLookupTest {

    @Mock
    private PrincipalLookup delegate;

    private CachingPrincipalLookup lookup;

    @BeforeEach
    void setUp() {
        lookup = new CachingPrincipalLookup(delegate, Duration.ofMinutes(5), 100);
    }

    @Test
    @DisplayName("Should hit the delegate once for repeated lookups")
    void cachesHits() {
        Principal alice = Principal.builder().id(1L).username("alice").role(UserRole.USER).build();
        when(delegate.findByUsername("alice")).thenReturn(Optional.of(alice));

        assertThat(lookup.findByUsername("alice")).contains(alice);
        assertThat(lookup.findByUsername("alice")).contains(alice);

        verify(delegate, times(1)).findByUsername("alice");
        assertThat(lookup.stats().hitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not remember unknown usernames")
    void doesNotCacheMisses() {
        when(delegate.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThat(lookup.findByUsername("ghost")).isEmpty();
        assertThat(lookup.findByUsername("ghost")).isEmpty();

        verify(delegate, times(2)).findByUsername("ghost");
    }
}
