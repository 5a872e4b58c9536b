package io.pockethive.phased.config;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable settings shared by the first and second rendering pass.
 *
 * @param delimiter      sentinel that bounds every marker; must never occur in rendered content
 * @param keepContext    capture the whole rendering context for every phased block
 * @param refetchNames   variables that are never serialized and are re-read from the ambient
 *                       context at second pass (CSRF tokens and similar lazy values)
 * @param maxDepth       how many nested marker generations the second pass expands
 * @param cacheKeyPrefix prefix of fragment cache keys
 */
public record PhasedConfig(
    String delimiter,
    boolean keepContext,
    List<String> refetchNames,
    int maxDepth,
    String cacheKeyPrefix
) {

    public static final String DEFAULT_CSRF_TOKEN_NAME = "csrf_token";
    public static final int DEFAULT_MAX_DEPTH = 16;
    public static final String DEFAULT_CACHE_KEY_PREFIX = "phased.cache";

    public PhasedConfig {
        Objects.requireNonNull(delimiter, "delimiter");
        if (delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        if (delimiter.chars().allMatch(PhasedConfig::isSnapshotChar)) {
            throw new IllegalArgumentException(
                "delimiter must contain at least one character outside [A-Za-z0-9_:-]");
        }
        refetchNames = refetchNames == null ? List.of() : List.copyOf(refetchNames);
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1");
        }
        cacheKeyPrefix = cacheKeyPrefix == null || cacheKeyPrefix.isBlank()
            ? DEFAULT_CACHE_KEY_PREFIX
            : cacheKeyPrefix.trim();
    }

    public static PhasedConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Derives a delimiter from a deployment secret so that every instance sharing the secret
     * (and therefore a fragment cache) emits the same markers.
     */
    public static String deriveDelimiter(String secret) {
        Objects.requireNonNull(secret, "secret");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(secret.getBytes(StandardCharsets.UTF_8));
            return "<!--phased:" + HexFormat.of().formatHex(hash, 0, 16) + "-->";
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static boolean isSnapshotChar(int c) {
        return (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= '0' && c <= '9')
            || c == '_' || c == '-' || c == ':';
    }

    public static final class Builder {
        private String delimiter;
        private String secret;
        private boolean keepContext;
        private List<String> refetchNames = List.of(DEFAULT_CSRF_TOKEN_NAME);
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private String cacheKeyPrefix = DEFAULT_CACHE_KEY_PREFIX;

        private Builder() {
        }

        public Builder delimiter(String delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Secret used to derive the delimiter when none is set explicitly. Without either, a
         * random secret is used and markers only resolve inside the current process.
         */
        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder keepContext(boolean keepContext) {
            this.keepContext = keepContext;
            return this;
        }

        public Builder refetchNames(List<String> refetchNames) {
            this.refetchNames = refetchNames;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder cacheKeyPrefix(String cacheKeyPrefix) {
            this.cacheKeyPrefix = cacheKeyPrefix;
            return this;
        }

        public PhasedConfig build() {
            String resolved = delimiter;
            if (resolved == null) {
                resolved = deriveDelimiter(secret != null ? secret : UUID.randomUUID().toString());
            }
            return new PhasedConfig(resolved, keepContext, refetchNames, maxDepth, cacheKeyPrefix);
        }
    }
}
