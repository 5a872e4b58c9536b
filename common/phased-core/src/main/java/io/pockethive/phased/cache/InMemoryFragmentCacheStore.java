package io.pockethive.phased.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory fragment storage per process. Expired entries are dropped on read.
 */
public class InMemoryFragmentCacheStore implements FragmentCacheStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryFragmentCacheStore() {
        this(Clock.systemUTC());
    }

    public InMemoryFragmentCacheStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.text());
    }

    @Override
    public void put(String key, String text, Duration ttl) {
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative()
            ? null
            : clock.instant().plus(ttl);
        entries.put(key, new Entry(text, expiresAt));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private record Entry(String text, Instant expiresAt) {
    }
}
