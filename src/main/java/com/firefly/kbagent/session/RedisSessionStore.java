package com.firefly.kbagent.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.firefly.kbagent.util.LogMasking.maskId;

/**
 * 会话表的Redis实现。
 * - {prefix}session:{sessionId} 保存会话JSON
 * - {prefix}user:{userId}:sessions 有序集合，score为时间戳，提供按用户、按时间倒序的访问路径
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RedisSessionStore implements SessionStore {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final SessionProperties properties;

    @Override
    public boolean validateOwnership(String sessionId, String userId) {
        return findOwned(sessionId, userId).isPresent();
    }

    @Override
    public Optional<Session> findOwned(String sessionId, String userId) {
        if (!StringUtils.hasText(sessionId) || !StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        try {
            return read(sessionId).filter(session -> userId.equals(session.getUserId()));
        } catch (Exception e) {
            // 查询失败按"无权访问"处理
            log.error("校验会话归属失败: sessionId={}, userId={}, error={}",
                    maskId(sessionId), maskId(userId), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(Session session) {
        if (session == null || !StringUtils.hasText(session.getSessionId())
                || !StringUtils.hasText(session.getUserId())) {
            throw new IllegalArgumentException("sessionId and userId are required");
        }
        Optional<Session> existing = read(session.getSessionId());
        if (existing.isPresent() && !session.getUserId().equals(existing.get().getUserId())) {
            throw new IllegalStateException("Session owner cannot change: " + maskId(session.getSessionId()));
        }
        long score = session.getTimestamp() != null ? session.getTimestamp() : System.currentTimeMillis();
        String key = sessionKey(session.getSessionId());
        String indexKey = userSessionsKey(session.getUserId());
        String json = serialize(session);
        Duration ttl = properties.getTtl();
        boolean expiring = ttl != null && !ttl.isZero() && !ttl.isNegative();
        if (expiring) {
            stringRedisTemplate.opsForValue().set(key, json, ttl);
        } else {
            stringRedisTemplate.opsForValue().set(key, json);
        }
        stringRedisTemplate.opsForZSet().add(indexKey, session.getSessionId(), score);
        if (expiring) {
            // 索引中早于 score - ttl 的成员对应的记录已过期
            stringRedisTemplate.opsForZSet().removeRangeByScore(indexKey, Double.NEGATIVE_INFINITY,
                    score - ttl.toMillis());
            stringRedisTemplate.expire(indexKey, ttl);
        }
    }

    @Override
    public List<Session> query(String userId, int limit) {
        if (!StringUtils.hasText(userId) || limit <= 0) {
            return Collections.emptyList();
        }
        Set<String> sessionIds = stringRedisTemplate.opsForZSet()
                .reverseRange(userSessionsKey(userId), 0, limit - 1L);
        if (sessionIds == null || sessionIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> keys = new ArrayList<>(sessionIds.size());
        for (String id : sessionIds) {
            keys.add(sessionKey(id));
        }
        List<String> values = stringRedisTemplate.opsForValue().multiGet(keys);
        if (values == null) {
            return Collections.emptyList();
        }
        List<Session> sessions = new ArrayList<>(values.size());
        for (String value : values) {
            // 记录已过期时索引中可能残留会话ID
            if (value == null) {
                continue;
            }
            Session session = deserialize(value);
            if (session != null && userId.equals(session.getUserId())) {
                sessions.add(session);
            }
        }
        return sessions;
    }

    private Optional<Session> read(String sessionId) {
        String json = stringRedisTemplate.opsForValue().get(sessionKey(sessionId));
        return json == null ? Optional.empty() : Optional.ofNullable(deserialize(json));
    }

    private String serialize(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化会话失败", e);
        }
    }

    private Session deserialize(String json) {
        try {
            return objectMapper.readValue(json, Session.class);
        } catch (JsonProcessingException e) {
            log.warn("反序列化会话失败: {}", e.getMessage());
            return null;
        }
    }

    private String sessionKey(String sessionId) {
        return properties.getKeyPrefix() + "session:" + sessionId;
    }

    private String userSessionsKey(String userId) {
        return properties.getKeyPrefix() + "user:" + userId + ":sessions";
    }
}
