package com.quantsim.simulator.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsim.simulator.exception.CacheCorruptedException;
import com.quantsim.simulator.marketdata.CacheKey;
import com.quantsim.simulator.marketdata.PriceCacheEntry;
import com.quantsim.simulator.marketdata.PriceCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache store keeping each cache unit as one JSON string value in Redis.
 */
@Slf4j
public class RedisPriceCacheStore implements PriceCacheStore {

    private static final String KEY_PREFIX = "price-cache:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    /**
     * @param ttl expiry of each unit; zero or null keeps units until overwritten
     */
    public RedisPriceCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public Optional<PriceCacheEntry> load(CacheKey key) {
        String json = redisTemplate.opsForValue().get(redisKey(key));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PriceCacheEntry.class));
        } catch (JsonProcessingException e) {
            throw new CacheCorruptedException("Unreadable cache unit " + key.asString(), e);
        }
    }

    @Override
    public void save(PriceCacheEntry entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache unit " + entry.key().asString(), e);
        }
        String key = redisKey(entry.key());
        if (ttl != null && !ttl.isZero()) {
            redisTemplate.opsForValue().set(key, json, ttl);
        } else {
            redisTemplate.opsForValue().set(key, json);
        }
        log.debug("Saved cache unit {} to Redis", key);
    }

    private static String redisKey(CacheKey key) {
        return KEY_PREFIX + key.asString();
    }
}
