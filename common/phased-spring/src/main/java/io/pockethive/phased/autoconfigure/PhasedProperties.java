package io.pockethive.phased.autoconfigure;

import io.pockethive.phased.config.PhasedConfig;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Phased template settings bound from {@code pockethive.phased.*}.
 */
@ConfigurationProperties(prefix = "pockethive.phased")
public class PhasedProperties {

    private String delimiter;
    private String secret;
    private boolean keepContext = false;
    private List<String> refetchNames = new ArrayList<>(List.of(PhasedConfig.DEFAULT_CSRF_TOKEN_NAME));
    private int maxDepth = PhasedConfig.DEFAULT_MAX_DEPTH;
    private boolean autoEscaping = false;
    private final Cache cache = new Cache();

    public String getDelimiter() {
        return delimiter;
    }

    /**
     * Marker delimiter. Takes precedence over {@link #setSecret(String) secret}.
     */
    public void setDelimiter(String delimiter) {
        this.delimiter = normalise(delimiter);
    }

    public String getSecret() {
        return secret;
    }

    /**
     * Deployment secret the delimiter is derived from. Instances sharing a fragment cache need the
     * same secret.
     */
    public void setSecret(String secret) {
        this.secret = normalise(secret);
    }

    public boolean isKeepContext() {
        return keepContext;
    }

    public void setKeepContext(boolean keepContext) {
        this.keepContext = keepContext;
    }

    public List<String> getRefetchNames() {
        return refetchNames;
    }

    public void setRefetchNames(List<String> refetchNames) {
        List<String> names = new ArrayList<>();
        if (refetchNames != null) {
            for (String name : refetchNames) {
                String trimmed = normalise(name);
                if (trimmed != null) {
                    names.add(trimmed);
                }
            }
        }
        this.refetchNames = names;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = Math.max(1, maxDepth);
    }

    public boolean isAutoEscaping() {
        return autoEscaping;
    }

    public void setAutoEscaping(boolean autoEscaping) {
        this.autoEscaping = autoEscaping;
    }

    public Cache getCache() {
        return cache;
    }

    public PhasedConfig toConfig() {
        return PhasedConfig.builder()
            .delimiter(delimiter)
            .secret(secret)
            .keepContext(keepContext)
            .refetchNames(refetchNames)
            .maxDepth(maxDepth)
            .cacheKeyPrefix(cache.getKeyPrefix())
            .build();
    }

    private static String normalise(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static class Cache {

        /**
         * {@code auto} uses Redis when a {@code StringRedisTemplate} is available.
         */
        private Store store = Store.AUTO;
        private String keyPrefix = PhasedConfig.DEFAULT_CACHE_KEY_PREFIX;

        public Store getStore() {
            return store;
        }

        public void setStore(Store store) {
            this.store = store == null ? Store.AUTO : store;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            String trimmed = normalise(keyPrefix);
            this.keyPrefix = trimmed == null ? PhasedConfig.DEFAULT_CACHE_KEY_PREFIX : trimmed;
        }
    }

    public enum Store {
        AUTO,
        MEMORY,
        REDIS
    }
}
