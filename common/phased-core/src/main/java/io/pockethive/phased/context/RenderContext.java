package io.pockethive.phased.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable chain of variable layers used while rendering.
 * <p>
 * Layers pushed later shadow earlier ones. A key mapped to {@code null} is present; only a key
 * missing from every layer is unknown.
 */
public final class RenderContext {

    private static final RenderContext EMPTY = new RenderContext(List.of());

    private final List<Map<String, Object>> layers;

    private RenderContext(List<Map<String, Object>> layers) {
        this.layers = layers;
    }

    public static RenderContext empty() {
        return EMPTY;
    }

    public static RenderContext of(Map<String, ?> variables) {
        return EMPTY.push(variables);
    }

    /**
     * Returns a new context with {@code layer} as the innermost scope.
     */
    public RenderContext push(Map<String, ?> layer) {
        if (layer == null || layer.isEmpty()) {
            return this;
        }
        List<Map<String, Object>> next = new ArrayList<>(layers.size() + 1);
        next.addAll(layers);
        next.add(Collections.unmodifiableMap(new LinkedHashMap<>(layer)));
        return new RenderContext(Collections.unmodifiableList(next));
    }

    public boolean containsKey(String name) {
        for (int i = layers.size() - 1; i >= 0; i--) {
            if (layers.get(i).containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    public Object get(String name) {
        for (int i = layers.size() - 1; i >= 0; i--) {
            Map<String, Object> layer = layers.get(i);
            if (layer.containsKey(name)) {
                return layer.get(name);
            }
        }
        return null;
    }

    /**
     * Resolves a variable name or dotted path.
     *
     * @throws UnknownVariableException when any step of the path is missing
     */
    public Object resolve(String path) {
        Objects.requireNonNull(path, "path");
        return VariablePaths.resolve(this, path);
    }

    /**
     * Collapses all layers into one map; the most specific scope wins for duplicate names.
     */
    public Map<String, Object> flatten() {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map<String, Object> layer : layers) {
            flat.putAll(layer);
        }
        return flat;
    }

    public List<Map<String, Object>> layers() {
        return layers;
    }

    @Override
    public String toString() {
        return "RenderContext" + layers;
    }
}
