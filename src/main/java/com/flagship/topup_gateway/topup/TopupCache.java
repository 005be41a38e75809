package com.flagship.topup_gateway.topup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.topup_gateway.topup.dto.TopupResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache-aside store for single topups, keyed by topup id.
 *
 * Redis is an optimization only: every failure is logged and treated as a
 * miss (reads) or ignored (writes, evictions). Entries carry a bounded TTL so
 * an eviction lost between a committed write and the cache call only leaves
 * a stale entry until expiry.
 */
@Component
@Slf4j
public class TopupCache {

    static final String TOPUP_BY_ID_KEY = "topup:id:%d";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public TopupCache(Optional<StringRedisTemplate> redisTemplate,
                      ObjectMapper objectMapper,
                      @Value("${topup.cache.ttl:5m}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    public Optional<TopupResponse> getCachedTopup(long topupId) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        String key = keyFor(topupId);
        try {
            String json = redisTemplate.get().opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, TopupResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            deleteCachedTopup(topupId);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Redis lookup failed for {}. Falling back to database. Error: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void setCachedTopup(TopupResponse topup) {
        if (redisTemplate.isEmpty() || topup == null) {
            return;
        }
        String key = keyFor(topup.getId());
        try {
            redisTemplate.get().opsForValue().set(key, objectMapper.writeValueAsString(topup), ttl);
            log.debug("Cached topup {} for {}", topup.getId(), ttl);
        } catch (Exception e) {
            log.warn("Failed to cache {}: {}", key, e.getMessage());
        }
    }

    public void deleteCachedTopup(long topupId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        String key = keyFor(topupId);
        try {
            redisTemplate.get().delete(key);
            log.debug("Evicted {}", key);
        } catch (Exception e) {
            log.warn("Failed to evict {} (expires in at most {}): {}", key, ttl, e.getMessage());
        }
    }

    static String keyFor(long topupId) {
        return String.format(TOPUP_BY_ID_KEY, topupId);
    }
}
