package io.pockethive.phased.marker;

import io.pockethive.phased.config.PhasedConfig;
import io.pockethive.phased.context.RenderContext;
import io.pockethive.phased.snapshot.ContextSnapshot;
import io.pockethive.phased.snapshot.MalformedSnapshotException;
import io.pockethive.phased.snapshot.SnapshotCodec;
import io.pockethive.phased.snapshot.SnapshotSerializationException;
import io.pockethive.phased.templating.TemplateRenderer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second pass: finds markers in composed output and replaces each one with its literal content
 * rendered against the restored snapshot.
 * <p>
 * Markers are resolved left to right. The rendered content of a marker may contain new markers
 * (nested phased blocks); those are resolved immediately, before the scan moves on to the next
 * sibling, up to {@link PhasedConfig#maxDepth()} generations deep.
 * <p>
 * Delimiters that do not frame a well-formed marker are left in the output as ordinary text.
 */
public final class SecondPassResolver {

    private static final Logger log = LoggerFactory.getLogger(SecondPassResolver.class);

    private final String delimiter;
    private final int maxDepth;
    private final SnapshotCodec codec;
    private final TemplateRenderer renderer;
    private final AmbientValueProvider ambientValues;

    public SecondPassResolver(PhasedConfig config,
                              SnapshotCodec codec,
                              TemplateRenderer renderer,
                              AmbientValueProvider ambientValues) {
        Objects.requireNonNull(config, "config");
        this.delimiter = config.delimiter();
        this.maxDepth = config.maxDepth();
        this.codec = Objects.requireNonNull(codec, "codec");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.ambientValues = ambientValues == null ? AmbientValueProvider.CONTEXT : ambientValues;
    }

    /**
     * Resolves every marker in {@code text}.
     *
     * @throws MalformedSnapshotException after the scan when at least one marker carried an
     *         unreadable snapshot; such markers stay in {@link MalformedSnapshotException#partialResult()}
     *         while all others are resolved
     */
    public String resolve(String text, RenderContext ambient) {
        Objects.requireNonNull(text, "text");
        RenderContext context = ambient == null ? RenderContext.empty() : ambient;
        Failures failures = new Failures();
        String resolved = resolve(text, context, 0, failures);
        if (failures.count > 0) {
            throw new MalformedSnapshotException(resolved, failures.count, failures.first);
        }
        return resolved;
    }

    public boolean containsMarkers(String text) {
        return text != null && text.contains(delimiter);
    }

    private String resolve(String text, RenderContext ambient, int depth, Failures failures) {
        if (!containsMarkers(text)) {
            return text;
        }
        if (depth >= maxDepth) {
            log.warn("Phased markers nested deeper than {} levels; leaving the remainder unresolved", maxDepth);
            return text;
        }
        int width = delimiter.length();
        StringBuilder out = new StringBuilder(text.length());
        int position = 0;
        while (true) {
            int open = text.indexOf(delimiter, position);
            if (open < 0) {
                break;
            }
            int middle = text.indexOf(delimiter, open + width);
            if (middle < 0) {
                break;
            }
            int close = text.indexOf(delimiter, middle + width);
            if (close < 0) {
                break;
            }
            String encoded = text.substring(middle + width, close);
            if (!codec.isSnapshotShaped(encoded)) {
                // not a marker; keep the first delimiter as text and retry from the second one
                out.append(text, position, middle);
                position = middle;
                continue;
            }
            out.append(text, position, open);
            String content = text.substring(open + width, middle);
            ContextSnapshot snapshot;
            try {
                snapshot = codec.decode(encoded);
            } catch (MalformedSnapshotException ex) {
                log.warn("Skipping phased marker with unreadable snapshot: {}", ex.getMessage());
                failures.record(ex);
                out.append(text, open, close + width);
                position = close + width;
                continue;
            }
            out.append(render(content, snapshot, ambient, depth, failures));
            position = close + width;
        }
        out.append(text, position, text.length());
        return out.toString();
    }

    private String render(String content,
                          ContextSnapshot snapshot,
                          RenderContext ambient,
                          int depth,
                          Failures failures) {
        Map<String, Object> restored = new LinkedHashMap<>();
        snapshot.values().forEach((name, value) -> restored.put(name, overlay(ambient, name, value)));
        for (String name : snapshot.refetch()) {
            Object fresh = ambientValues.fetch(name, ambient);
            if (fresh != null) {
                restored.put(name, fresh);
            } else {
                log.debug("No ambient value to restore '{}' for phased block", name);
            }
        }
        String rendered = renderer.render(content, ambient.push(restored));
        return resolve(rendered, ambient, depth + 1, failures);
    }

    // captured dotted names hold only part of a root object; the ambient root supplies the rest
    private Object overlay(RenderContext ambient, String name, Object captured) {
        if (!(captured instanceof Map<?, ?> capturedMap) || !ambient.containsKey(name)) {
            return captured;
        }
        Object current = ambient.get(name);
        if (!(current instanceof Map<?, ?>) && current != null) {
            try {
                current = codec.normalize(current);
            } catch (SnapshotSerializationException ex) {
                log.debug("Ambient '{}' cannot be merged with its phased snapshot: {}", name, ex.getMessage());
                return captured;
            }
        }
        if (!(current instanceof Map<?, ?> currentMap)) {
            return captured;
        }
        return merge(currentMap, capturedMap);
    }

    private static Map<Object, Object> merge(Map<?, ?> base, Map<?, ?> captured) {
        Map<Object, Object> merged = new LinkedHashMap<>(base);
        captured.forEach((key, value) -> {
            Object existing = merged.get(key);
            if (value instanceof Map<?, ?> nested && existing instanceof Map<?, ?> existingMap) {
                merged.put(key, merge(existingMap, nested));
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    private static final class Failures {
        private int count;
        private MalformedSnapshotException first;

        void record(MalformedSnapshotException ex) {
            if (first == null) {
                first = ex;
            }
            count++;
        }
    }
}
