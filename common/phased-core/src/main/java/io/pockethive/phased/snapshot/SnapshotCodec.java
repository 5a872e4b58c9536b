package io.pockethive.phased.snapshot;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Text codec for {@link ContextSnapshot}s embedded in markers.
 * <p>
 * The encoded form is {@code ctx:} followed by unpadded base64url of a JSON envelope, so it never
 * contains template syntax. Values are normalized to the JSON value model before they enter a
 * snapshot, which makes {@code decode(encode(snapshot))} equal to {@code snapshot}.
 */
public final class SnapshotCodec {

    public static final String PREFIX = "ctx:";

    private static final int VERSION = 1;
    private static final Pattern SHAPE = Pattern.compile("ctx:[A-Za-z0-9_-]*");
    // NaN and infinities are written as bare tokens so they come back as doubles, not strings
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .findAndAddModules()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .build();

    public String encode(ContextSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        SnapshotEnvelope envelope = new SnapshotEnvelope(
            VERSION,
            snapshot.values(),
            new ArrayList<>(snapshot.refetch())
        );
        try {
            byte[] json = MAPPER.writeValueAsBytes(envelope);
            return PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (Exception ex) {
            throw new SnapshotSerializationException("Failed to serialize phased snapshot", ex);
        }
    }

    public ContextSnapshot decode(String encoded) {
        if (!isSnapshotShaped(encoded)) {
            throw new MalformedSnapshotException("Not a phased snapshot", null);
        }
        SnapshotEnvelope envelope;
        try {
            byte[] json = Base64.getUrlDecoder().decode(encoded.substring(PREFIX.length()));
            envelope = MAPPER.readValue(json, SnapshotEnvelope.class);
        } catch (Exception ex) {
            throw new MalformedSnapshotException("Failed to deserialize phased snapshot", ex);
        }
        if (envelope == null || envelope.version() != VERSION) {
            throw new MalformedSnapshotException("Unsupported phased snapshot version", null);
        }
        List<String> refetch = envelope.refetch();
        return new ContextSnapshot(envelope.values(), refetch == null ? null : new LinkedHashSet<>(refetch));
    }

    /**
     * Whether {@code text} has the outer shape of an encoded snapshot. Only shaped sections are
     * treated as markers; anything else between delimiters is ordinary text.
     */
    public boolean isSnapshotShaped(String text) {
        return text != null && SHAPE.matcher(text).matches();
    }

    /**
     * Converts a context value to the form it has after a serialization round trip. Floating
     * point values, {@code NaN} and infinities included, come back as {@link Double}.
     *
     * @throws SnapshotSerializationException when the value cannot be serialized
     */
    public Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Integer) {
            return value;
        }
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(value), Object.class);
        } catch (Exception ex) {
            throw new SnapshotSerializationException(
                "Value of type " + value.getClass().getName() + " cannot be serialized", ex);
        }
    }

    record SnapshotEnvelope(int version, Map<String, Object> values, List<String> refetch) {
    }
}
