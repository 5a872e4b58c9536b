package io.pockethive.phased.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value storage for pre-second-pass fragment text.
 * <p>
 * Implementations may throw on backend failures; {@link FragmentCache} treats any failure as a
 * cache miss.
 */
public interface FragmentCacheStore {

    Optional<String> get(String key);

    /**
     * Stores {@code text} under {@code key}.
     *
     * @param ttl time to live; {@link Duration#ZERO} or negative means no expiry
     */
    void put(String key, String text, Duration ttl);
}
