package io.pockethive.phased.autoconfigure;

import io.pockethive.phased.cache.FragmentCacheStore;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed fragment storage, shared by every instance that talks to the same Redis.
 */
public class RedisFragmentCacheStore implements FragmentCacheStore {

    private final StringRedisTemplate redis;

    public RedisFragmentCacheStore(StringRedisTemplate redis) {
        this.redis = Objects.requireNonNull(redis, "redis");
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void put(String key, String text, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(key, text);
        } else {
            redis.opsForValue().set(key, text, ttl);
        }
    }
}
