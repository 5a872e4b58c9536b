package io.pockethive.phased.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.pockethive.phased.context.RenderContext;
import io.pockethive.phased.marker.SecondPassResolver;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fragment cache that stores text <em>before</em> the second pass.
 * <p>
 * Cached text keeps its markers, so deferred blocks inside a cached fragment are recomputed on
 * every hit. Store failures are logged and treated as misses.
 */
public final class FragmentCache {

    private static final Logger log = LoggerFactory.getLogger(FragmentCache.class);
    private static final String METRIC = "phased.fragment.cache";

    private final FragmentCacheStore store;
    private final SecondPassResolver resolver;
    private final String keyPrefix;
    private final Counter hits;
    private final Counter misses;
    private final Counter errors;

    public FragmentCache(FragmentCacheStore store,
                         SecondPassResolver resolver,
                         String keyPrefix,
                         MeterRegistry meterRegistry) {
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.hits = Counter.builder(METRIC).tag("result", "hit").register(meterRegistry);
        this.misses = Counter.builder(METRIC).tag("result", "miss").register(meterRegistry);
        this.errors = Counter.builder(METRIC).tag("result", "error").register(meterRegistry);
    }

    /**
     * Returns the second-pass output of the fragment, rendering and caching it on a miss.
     *
     * @param fragmentName cache fragment name
     * @param varyArgs     values that, with the name, identify the entry
     * @param ttl          entry lifetime; zero means no expiry
     * @param renderer     first-pass renderer of the fragment body
     * @param ambient      context of the ongoing render, used for the second pass
     */
    public String getOrRender(String fragmentName,
                              List<?> varyArgs,
                              Duration ttl,
                              Supplier<String> renderer,
                              RenderContext ambient) {
        Objects.requireNonNull(fragmentName, "fragmentName");
        Objects.requireNonNull(renderer, "renderer");
        String key = cacheKey(fragmentName, varyArgs);
        Optional<String> cached = lookup(key);
        if (cached.isPresent()) {
            hits.increment();
            log.debug("Fragment cache hit for {}", key);
            return resolver.resolve(cached.get(), ambient);
        }
        misses.increment();
        String raw = renderer.get();
        save(key, raw, ttl);
        return resolver.resolve(raw, ambient);
    }

    /**
     * Key for a fragment: prefix, name and an MD5 digest of the URL-encoded vary values.
     */
    public String cacheKey(String fragmentName, List<?> varyArgs) {
        StringBuilder joined = new StringBuilder();
        if (varyArgs != null) {
            for (int i = 0; i < varyArgs.size(); i++) {
                if (i > 0) {
                    joined.append(':');
                }
                joined.append(URLEncoder.encode(String.valueOf(varyArgs.get(i)), StandardCharsets.UTF_8));
            }
        }
        return keyPrefix + "." + fragmentName + "." + md5Hex(joined.toString());
    }

    private Optional<String> lookup(String key) {
        try {
            Optional<String> cached = store.get(key);
            return cached == null ? Optional.empty() : cached;
        } catch (RuntimeException ex) {
            errors.increment();
            log.warn("Fragment cache read failed for {}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    private void save(String key, String raw, Duration ttl) {
        try {
            store.put(key, raw, ttl == null ? Duration.ZERO : ttl);
        } catch (RuntimeException ex) {
            errors.increment();
            log.warn("Fragment cache write failed for {}: {}", key, ex.getMessage());
        }
    }

    private static String md5Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }
}
