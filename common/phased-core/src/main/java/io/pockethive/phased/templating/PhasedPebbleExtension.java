package io.pockethive.phased.templating;

import com.mitchellbosecke.pebble.extension.AbstractExtension;
import com.mitchellbosecke.pebble.extension.Function;
import com.mitchellbosecke.pebble.extension.escaper.SafeString;
import com.mitchellbosecke.pebble.template.EvaluationContext;
import com.mitchellbosecke.pebble.template.EvaluationContextImpl;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import com.mitchellbosecke.pebble.template.Scope;
import com.mitchellbosecke.pebble.tokenParser.TokenParser;
import io.pockethive.phased.cache.FragmentCache;
import io.pockethive.phased.context.RenderContext;
import io.pockethive.phased.context.VariablePaths;
import io.pockethive.phased.marker.MarkerEmitter;
import io.pockethive.phased.parser.DeferredBlock;
import io.pockethive.phased.parser.PhasedTemplateCompiler;
import io.pockethive.phased.snapshot.ContextSnapshot;
import io.pockethive.phased.snapshot.SnapshotCapture;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pebble side of the phased protocol.
 * <ul>
 *   <li>{@code phased(block)} – emitted by {@link PhasedTemplateCompiler} in place of each phased
 *   block; captures the snapshot and writes the marker</li>
 *   <li>{@code {% phasedcache <expire> <name> [vary ...] %}} – caches its body before the second
 *   pass, see {@link FragmentCache}</li>
 * </ul>
 */
final class PhasedPebbleExtension extends AbstractExtension {

    static final String CONTEXT_VARIABLE = "__phased_context";

    private final Function markerFunction;
    private final TokenParser cacheTokenParser;

    PhasedPebbleExtension(SnapshotCapture capture,
                          MarkerEmitter emitter,
                          boolean keepContext,
                          FragmentCache fragmentCache) {
        this.markerFunction = new MarkerFunction(capture, emitter, keepContext);
        this.cacheTokenParser = new PhasedCacheTokenParser(fragmentCache);
    }

    @Override
    public Map<String, Function> getFunctions() {
        return Map.of(PhasedTemplateCompiler.MARKER_FUNCTION, markerFunction);
    }

    @Override
    public List<TokenParser> getTokenParsers() {
        return List.of(cacheTokenParser);
    }

    /**
     * The layered context the current render was started with, or an empty one when the template
     * was evaluated outside {@link PebbleTemplateRenderer}.
     */
    static RenderContext ambientContext(EvaluationContext context) {
        Object value = context.getVariable(CONTEXT_VARIABLE);
        return value instanceof RenderContext renderContext ? renderContext : RenderContext.empty();
    }

    private static final class MarkerFunction implements Function {

        private final SnapshotCapture capture;
        private final MarkerEmitter emitter;
        private final boolean keepContext;

        private MarkerFunction(SnapshotCapture capture, MarkerEmitter emitter, boolean keepContext) {
            this.capture = Objects.requireNonNull(capture, "capture");
            this.emitter = Objects.requireNonNull(emitter, "emitter");
            this.keepContext = keepContext;
        }

        @Override
        public List<String> getArgumentNames() {
            return List.of("block");
        }

        @Override
        public Object execute(Map<String, Object> args,
                              PebbleTemplate self,
                              EvaluationContext context,
                              int lineNumber) {
            DeferredBlock block = DeferredBlock.decode(Objects.toString(args.get("block"), ""));
            RenderContext view = ambientContext(context).push(templateScope(block, context));
            ContextSnapshot snapshot = capture.capture(view, block.variableNames(), keepContext);
            return new SafeString(emitter.emit(block.literal(), snapshot));
        }

        // loop variables and {% set %} values live only in Pebble's scope chain
        private Map<String, Object> templateScope(DeferredBlock block, EvaluationContext context) {
            Map<String, Object> scope = new LinkedHashMap<>();
            if (keepContext && context instanceof EvaluationContextImpl impl) {
                for (Scope layer : impl.getScopeChain().getGlobalScopes()) {
                    for (String key : layer.getKeys()) {
                        if (!CONTEXT_VARIABLE.equals(key) && !scope.containsKey(key)) {
                            // getVariable applies shadowing across the chain
                            scope.put(key, context.getVariable(key));
                        }
                    }
                }
            }
            for (String requested : block.variableNames()) {
                String name = SnapshotCapture.unquote(requested);
                for (String candidate : List.of(name, VariablePaths.root(name))) {
                    Object value = context.getVariable(candidate);
                    if (value != null) {
                        scope.put(candidate, value);
                    }
                }
            }
            return scope;
        }
    }
}
