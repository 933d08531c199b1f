package com.firefly.kbagent.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSessionStoreTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SessionProperties properties;
    private RedisSessionStore store;

    @BeforeEach
    void setUp() {
        properties = new SessionProperties();
        lenient().when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        lenient().when(stringRedisTemplate.opsForZSet()).thenReturn(zSetOperations);
        store = new RedisSessionStore(stringRedisTemplate, objectMapper, properties);
    }

    @Test
    void ownershipIsFalseForMissingAndForeignSessionsAlike() throws JsonProcessingException {
        when(valueOperations.get("kbagent:session:missing")).thenReturn(null);
        when(valueOperations.get("kbagent:session:s-1")).thenReturn(json(session("s-1", "owner", 1L)));

        assertThat(store.validateOwnership("missing", "intruder")).isFalse();
        assertThat(store.validateOwnership("s-1", "intruder")).isFalse();
        assertThat(store.validateOwnership("s-1", "owner")).isTrue();
    }

    @Test
    void ownershipFailsClosedWhenStoreIsUnavailable() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(store.validateOwnership("s-1", "owner")).isFalse();
        assertThat(store.findOwned("s-1", "owner")).isEmpty();
    }

    @Test
    void putShouldWriteRecordAndRecencyIndex() throws JsonProcessingException {
        Session session = session("s-1", "owner", 1_700_000_000_000L);

        store.put(session);

        verify(valueOperations).set("kbagent:session:s-1", json(session));
        verify(zSetOperations).add("kbagent:user:owner:sessions", "s-1", 1_700_000_000_000d);
        verify(zSetOperations, never()).removeRangeByScore(anyString(), anyDouble(), anyDouble());
        verify(stringRedisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void putShouldApplyTtlToRecordAndTrimRecencyIndex() throws JsonProcessingException {
        properties.setTtl(Duration.ofDays(30));
        long now = 1_700_000_000_000L;
        Session session = session("s-1", "owner", now);

        store.put(session);

        verify(valueOperations).set("kbagent:session:s-1", json(session), Duration.ofDays(30));
        verify(zSetOperations).add("kbagent:user:owner:sessions", "s-1", (double) now);
        verify(zSetOperations).removeRangeByScore("kbagent:user:owner:sessions", Double.NEGATIVE_INFINITY,
                (double) (now - Duration.ofDays(30).toMillis()));
        verify(stringRedisTemplate).expire("kbagent:user:owner:sessions", Duration.ofDays(30));
    }

    @Test
    void putShouldRefuseToChangeOwner() throws JsonProcessingException {
        when(valueOperations.get("kbagent:session:s-1")).thenReturn(json(session("s-1", "owner", 1L)));

        assertThatThrownBy(() -> store.put(session("s-1", "intruder", 2L)))
                .isInstanceOf(IllegalStateException.class);
        verify(valueOperations, never()).set(anyString(), anyString());
    }

    @Test
    void queryShouldReturnNewestFirstAndSkipStaleOrForeignEntries() throws JsonProcessingException {
        Set<String> ids = new LinkedHashSet<>(List.of("s-3", "s-2", "s-1", "s-0"));
        when(zSetOperations.reverseRange("kbagent:user:owner:sessions", 0, 9)).thenReturn(ids);
        when(valueOperations.multiGet(List.of("kbagent:session:s-3", "kbagent:session:s-2",
                "kbagent:session:s-1", "kbagent:session:s-0")))
                .thenReturn(Arrays.asList(
                        json(session("s-3", "owner", 3L)),
                        null,
                        json(session("s-1", "owner", 1L)),
                        json(session("s-0", "someone-else", 0L))));

        List<Session> sessions = store.query("owner", 10);

        assertThat(sessions).extracting(Session::getSessionId).containsExactly("s-3", "s-1");
    }

    @Test
    void queryShouldReturnEmptyForNoSessions() {
        when(zSetOperations.reverseRange("kbagent:user:owner:sessions", 0, 19)).thenReturn(Set.of());

        assertThat(store.query("owner", 20)).isEmpty();
        assertThat(store.query("owner", 0)).isEmpty();
    }

    private static Session session(String id, String userId, long timestamp) {
        return Session.builder()
                .sessionId(id)
                .userId(userId)
                .lastMessage("hello")
                .lastResponse("hi")
                .timestamp(timestamp)
                .build();
    }

    private String json(Session session) throws JsonProcessingException {
        return objectMapper.writeValueAsString(session);
    }
}
