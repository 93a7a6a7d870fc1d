package com.eduanalytics.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache for single-payload aggregate reads (enrollment stats, dashboard, KPIs).
 *
 * All keys live under {@value #KEY_PREFIX}. Redis is optional at runtime: read and write
 * failures degrade to a miss, and the "redis" circuit breaker stops calling Redis while it
 * is down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    public static final String KEY_PREFIX = "analytics";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(cached, type));
        } catch (Exception e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Cannot serialize value for cache key {}: {}", key, e.getMessage());
            return;
        }
        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached {} (TTL: {}s)", key, ttlSeconds);
    }

    /**
     * Drops every cached aggregate. Called after loads that change the warehouse.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "evictAllFallback")
    public void evictAll() {
        Set<String> keys = redisTemplate.keys(KEY_PREFIX + ":*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
            log.info("Evicted {} cached aggregates", keys.size());
        }
    }

    public String generateCacheKey(String name, Object... params) {
        StringBuilder key = new StringBuilder(KEY_PREFIX).append(':').append(name);
        for (Object param : params) {
            key.append(':').append(param != null ? param.toString() : "all");
        }
        return key.toString();
    }

    // Fallbacks: a Redis failure behaves like a miss

    private <T> Optional<T> getCacheFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis unavailable, computing {} directly: {}", key, e.getMessage());
        return Optional.empty();
    }

    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable, not caching {}", key);
    }

    private void evictAllFallback(Exception e) {
        log.warn("Redis unavailable, cached aggregates not evicted: {}", e.getMessage());
    }
}
