package io.pockethive.phased.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * The unrendered body of a {@code phased} block and the variables it asks to keep.
 *
 * @param literal       body source exactly as written in the template
 * @param variableNames requested names in tag order, possibly quoted; empty when none were given
 */
public record DeferredBlock(String literal, List<String> variableNames) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public DeferredBlock {
        Objects.requireNonNull(literal, "literal");
        variableNames = variableNames == null ? List.of() : List.copyOf(variableNames);
    }

    /**
     * Encodes the block as a base64url token that is safe inside a template string literal.
     */
    public String encode() {
        try {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(MAPPER.writeValueAsBytes(this));
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to encode phased block", ex);
        }
    }

    public static DeferredBlock decode(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        try {
            return MAPPER.readValue(Base64.getUrlDecoder().decode(encoded), DeferredBlock.class);
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to decode phased block reference", ex);
        }
    }
}
