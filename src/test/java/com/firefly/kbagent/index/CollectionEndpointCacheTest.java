package com.firefly.kbagent.index;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CollectionEndpointCacheTest {

    @Mock
    private CollectionEndpointResolver resolver;

    @InjectMocks
    private CollectionEndpointCache cache;

    @Test
    void shouldResolveOncePerCollection() {
        when(resolver.resolve("kb")).thenReturn(Optional.of("https://kb.aoss.amazonaws.com"));

        assertThat(cache.get("kb")).contains("https://kb.aoss.amazonaws.com");
        assertThat(cache.get("kb")).contains("https://kb.aoss.amazonaws.com");

        verify(resolver, times(1)).resolve("kb");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldNotCacheMissingCollections() {
        when(resolver.resolve("missing")).thenReturn(Optional.empty());

        assertThat(cache.get("missing")).isEmpty();
        assertThat(cache.get("missing")).isEmpty();

        verify(resolver, times(2)).resolve("missing");
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldResolveAgainAfterInvalidation() {
        when(resolver.resolve("kb"))
                .thenReturn(Optional.of("https://old.aoss.amazonaws.com"))
                .thenReturn(Optional.of("https://new.aoss.amazonaws.com"));

        cache.get("kb");
        cache.invalidate("kb");

        assertThat(cache.get("kb")).contains("https://new.aoss.amazonaws.com");

        cache.clear();
        assertThat(cache.size()).isZero();
    }
}
