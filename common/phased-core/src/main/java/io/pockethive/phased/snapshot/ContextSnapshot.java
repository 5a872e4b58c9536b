package io.pockethive.phased.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Variables captured for one phased block, in serializable form.
 *
 * @param values  captured variables; nested values are plain maps, lists and JSON scalars
 * @param refetch names that were present at capture time but must be re-read from the ambient
 *                context at second pass instead of being serialized
 */
public record ContextSnapshot(Map<String, Object> values, Set<String> refetch) {

    private static final ContextSnapshot EMPTY = new ContextSnapshot(Map.of(), Set.of());

    public ContextSnapshot {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        refetch = refetch == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(refetch));
    }

    public static ContextSnapshot empty() {
        return EMPTY;
    }

    public boolean requiresRefetch(String name) {
        return refetch.contains(name);
    }
}
