package io.pockethive.phased.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SnapshotCodecTest {

    private final SnapshotCodec codec = new SnapshotCodec();

    record Point(int x, int y) {
    }

    public static class Loop {
        public Loop getSelf() {
            return this;
        }
    }

    @Test
    void decodesWhatItEncodes() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Ada");
        values.put("count", 3);
        values.put("ratio", 0.5);
        values.put("flag", true);
        values.put("nothing", null);
        values.put("nested", Map.of("list", List.of(1, "two")));
        ContextSnapshot snapshot = new ContextSnapshot(values, Set.of("csrf_token"));

        ContextSnapshot decoded = codec.decode(codec.encode(snapshot));

        assertThat(decoded).isEqualTo(snapshot);
        assertThat(decoded.requiresRefetch("csrf_token")).isTrue();
    }

    @Test
    void encodedFormHasNoTemplateSyntax() {
        ContextSnapshot snapshot = new ContextSnapshot(Map.of("html", "{% if %}{{ x }}<!-- -->"), Set.of());

        String encoded = codec.encode(snapshot);

        assertThat(encoded).startsWith(SnapshotCodec.PREFIX).matches("ctx:[A-Za-z0-9_-]*");
        assertThat(codec.isSnapshotShaped(encoded)).isTrue();
    }

    @Test
    void normalizesValuesToJsonModel() {
        assertThat(codec.normalize(new Point(1, 2))).isEqualTo(Map.of("x", 1, "y", 2));
        assertThat(codec.normalize(new int[] {1, 2})).isEqualTo(List.of(1, 2));
        assertThat(codec.normalize(Set.of("a"))).isEqualTo(List.of("a"));
        assertThat(codec.normalize("text")).isEqualTo("text");
        assertThat(codec.normalize(null)).isNull();
    }

    @Test
    void nonFiniteDoublesStayDoubles() {
        assertThat(codec.normalize(Double.NaN)).isEqualTo(Double.NaN);
        assertThat(codec.normalize(Double.POSITIVE_INFINITY)).isEqualTo(Double.POSITIVE_INFINITY);

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("nan", Double.NaN);
        values.put("low", Double.NEGATIVE_INFINITY);
        ContextSnapshot snapshot = new ContextSnapshot(values, Set.of());

        assertThat(codec.decode(codec.encode(snapshot))).isEqualTo(snapshot);
    }

    @Test
    void unserializableValueFails() {
        assertThatThrownBy(() -> codec.normalize(new Loop()))
            .isInstanceOf(SnapshotSerializationException.class);
    }

    @Test
    void rejectsForeignInput() {
        assertThatThrownBy(() -> codec.decode("hello")).isInstanceOf(MalformedSnapshotException.class);
        assertThatThrownBy(() -> codec.decode("ctx:!!")).isInstanceOf(MalformedSnapshotException.class);
        assertThatThrownBy(() -> codec.decode("ctx:" + base64("not json")))
            .isInstanceOf(MalformedSnapshotException.class);
        assertThatThrownBy(() -> codec.decode("ctx:" + base64("{\"version\":99,\"values\":{}}")))
            .isInstanceOf(MalformedSnapshotException.class)
            .hasMessageContaining("version");
    }

    @Test
    void emptySnapshotRoundTrips() {
        assertThat(codec.decode(codec.encode(ContextSnapshot.empty()))).isEqualTo(ContextSnapshot.empty());
    }

    private static String base64(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
