package io.pockethive.phased.templating;

import io.pockethive.phased.context.RenderContext;
import java.util.Map;

/**
 * Small, engine-agnostic templating API used by both rendering passes.
 * <p>
 * Implementations are expected to be thread-safe.
 */
public interface TemplateRenderer {

    /**
     * Renders the given {@code template} using the supplied context map.
     *
     * @param template non-null template source
     * @param context  rendering context (may be {@code null}, treated as empty)
     * @return rendered template result
     * @throws TemplateRenderingException when rendering fails
     */
    String render(String template, Map<String, Object> context);

    /**
     * Renders against a layered context. The default flattens the layers.
     */
    default String render(String template, RenderContext context) {
        return render(template, context == null ? Map.of() : context.flatten());
    }
}
