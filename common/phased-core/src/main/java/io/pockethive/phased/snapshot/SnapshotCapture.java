package io.pockethive.phased.snapshot;

import io.pockethive.phased.context.RenderContext;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link ContextSnapshot} of a phased block from the active rendering context.
 */
public final class SnapshotCapture {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCapture.class);

    private final SnapshotCodec codec;
    private final Set<String> refetchNames;

    public SnapshotCapture(SnapshotCodec codec, Collection<String> refetchNames) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.refetchNames = refetchNames == null ? Set.of() : Set.copyOf(refetchNames);
    }

    /**
     * Captures {@code requestedNames} (and every variable when {@code keepWhole} is set).
     *
     * @throws io.pockethive.phased.context.UnknownVariableException when a requested name is
     *         not resolvable
     * @throws SnapshotSerializationException when a requested value cannot be serialized
     */
    public ContextSnapshot capture(RenderContext context, List<String> requestedNames, boolean keepWhole) {
        Objects.requireNonNull(context, "context");
        Map<String, Object> values = new LinkedHashMap<>();
        if (keepWhole) {
            context.flatten().forEach((name, value) -> {
                if (refetchNames.contains(name)) {
                    return;
                }
                try {
                    values.put(name, codec.normalize(value));
                } catch (SnapshotSerializationException ex) {
                    log.debug("Leaving context variable '{}' out of phased snapshot: {}", name, ex.getMessage());
                }
            });
        }

        if (requestedNames != null) {
            for (String requested : requestedNames) {
                String name = unquote(requested);
                Object value = context.resolve(name);
                if (refetchNames.contains(name)) {
                    continue;
                }
                try {
                    store(values, name, codec.normalize(value), context);
                } catch (SnapshotSerializationException ex) {
                    throw new SnapshotSerializationException(
                        "Variable '" + name + "' requested by a phased block cannot be serialized", ex);
                }
            }
        }

        Set<String> refetch = new LinkedHashSet<>();
        for (String name : refetchNames) {
            if (context.containsKey(name)) {
                refetch.add(name);
                values.remove(name);
            }
        }
        return new ContextSnapshot(values, refetch);
    }

    /**
     * Strips one matching pair of surrounding single or double quotes.
     */
    public static String unquote(String name) {
        if (name.length() >= 2) {
            char first = name.charAt(0);
            if ((first == '"' || first == '\'') && name.charAt(name.length() - 1) == first) {
                return name.substring(1, name.length() - 1);
            }
        }
        return name;
    }

    // dotted paths are stored nested so the second pass reads them back with the same path;
    // a list or array on the way is kept whole so index access still works
    @SuppressWarnings("unchecked")
    private void store(Map<String, Object> values, String name, Object value, RenderContext context) {
        if (name.indexOf('.') < 0 || context.containsKey(name)) {
            values.put(name, value);
            return;
        }
        String[] segments = name.split("\\.");
        Map<String, Object> current = values;
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < segments.length - 1; i++) {
            if (i > 0) {
                prefix.append('.');
            }
            prefix.append(segments[i]);
            Object source = context.resolve(prefix.toString());
            if (isIndexed(source)) {
                current.put(segments[i], codec.normalize(source));
                return;
            }
            Object child = current.get(segments[i]);
            if (child == null && !current.containsKey(segments[i])) {
                child = new LinkedHashMap<String, Object>();
                current.put(segments[i], child);
            }
            if (!(child instanceof Map)) {
                values.put(name, value);
                return;
            }
            current = (Map<String, Object>) child;
        }
        current.put(segments[segments.length - 1], value);
    }

    private static boolean isIndexed(Object value) {
        return value instanceof Collection<?> || (value != null && value.getClass().isArray());
    }
}
