package io.pockethive.phased.marker;

import io.pockethive.phased.context.RenderContext;

/**
 * Supplies values that snapshots never carry (CSRF tokens and other lazy per-request values)
 * when a marker is resolved.
 */
@FunctionalInterface
public interface AmbientValueProvider {

    /**
     * Reads the value straight from the ambient context of the second pass.
     */
    AmbientValueProvider CONTEXT = (name, ambient) -> ambient.get(name);

    /**
     * Returns the current value for {@code name}, or {@code null} when none is available.
     */
    Object fetch(String name, RenderContext ambient);
}
