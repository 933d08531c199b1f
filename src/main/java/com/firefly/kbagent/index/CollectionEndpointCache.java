package com.firefly.kbagent.index;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 集合端点的进程级缓存。
 * 每个集合在进程生命周期内只解析一次，不会自动刷新；只能通过 invalidate/clear 显式失效。
 * 解析失败（集合不存在）不缓存。
 */
@Slf4j
public class CollectionEndpointCache {

    private final CollectionEndpointResolver resolver;
    private final Map<String, String> endpoints = new ConcurrentHashMap<>();

    public CollectionEndpointCache(CollectionEndpointResolver resolver) {
        this.resolver = resolver;
    }

    public Optional<String> get(String collectionId) {
        String cached = endpoints.get(collectionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> resolved = resolver.resolve(collectionId);
        resolved.ifPresent(endpoint -> {
            endpoints.put(collectionId, endpoint);
            log.debug("缓存集合端点: {} -> {}", collectionId, endpoint);
        });
        return resolved;
    }

    public void invalidate(String collectionId) {
        endpoints.remove(collectionId);
    }

    public void clear() {
        endpoints.clear();
    }

    public int size() {
        return endpoints.size();
    }
}
