package io.pockethive.phased.templating;

import com.mitchellbosecke.pebble.PebbleEngine;
import com.mitchellbosecke.pebble.error.PebbleException;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import io.pockethive.phased.PhasedTemplateException;
import io.pockethive.phased.context.RenderContext;
import io.pockethive.phased.parser.PhasedTemplateCompiler;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TemplateRenderer} backed by the Pebble templating engine.
 * <p>
 * Template source first goes through {@link PhasedTemplateCompiler}, then is rendered with
 * {@link PebbleEngine#getLiteralTemplate(String)} so templates are provided inline rather than
 * loaded from files. The layered {@link RenderContext} is exposed to the phased extension under
 * {@link PhasedPebbleExtension#CONTEXT_VARIABLE}.
 */
public final class PebbleTemplateRenderer implements TemplateRenderer {

    private final PebbleEngine engine;
    private final PhasedTemplateCompiler compiler;

    public PebbleTemplateRenderer(PebbleEngine engine) {
        this(engine, new PhasedTemplateCompiler());
    }

    public PebbleTemplateRenderer(PebbleEngine engine, PhasedTemplateCompiler compiler) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    @Override
    public String render(String templateSource, Map<String, Object> context) {
        return render(templateSource, context == null ? RenderContext.empty() : RenderContext.of(context));
    }

    @Override
    public String render(String templateSource, RenderContext context) {
        Objects.requireNonNull(templateSource, "templateSource");
        RenderContext safeContext = context == null ? RenderContext.empty() : context;
        String compiled = compiler.compile(templateSource);
        Map<String, Object> variables = new HashMap<>(safeContext.flatten());
        variables.put(PhasedPebbleExtension.CONTEXT_VARIABLE, safeContext);
        try {
            PebbleTemplate template = engine.getLiteralTemplate(compiled);
            try (Writer writer = new StringWriter()) {
                template.evaluate(writer, variables);
                return writer.toString();
            }
        } catch (PebbleException ex) {
            PhasedTemplateException phased = findPhasedFailure(ex);
            if (phased != null) {
                throw phased;
            }
            throw new TemplateRenderingException("Failed to render template", ex);
        } catch (IOException ex) {
            throw new TemplateRenderingException("Failed to render template", ex);
        }
    }

    private static PhasedTemplateException findPhasedFailure(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof PhasedTemplateException phased) {
                return phased;
            }
            current = current.getCause();
        }
        return null;
    }
}
