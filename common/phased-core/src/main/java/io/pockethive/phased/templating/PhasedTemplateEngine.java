package io.pockethive.phased.templating;

import com.mitchellbosecke.pebble.PebbleEngine;
import com.mitchellbosecke.pebble.extension.Extension;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pockethive.phased.cache.FragmentCache;
import io.pockethive.phased.cache.FragmentCacheStore;
import io.pockethive.phased.cache.InMemoryFragmentCacheStore;
import io.pockethive.phased.config.PhasedConfig;
import io.pockethive.phased.context.RenderContext;
import io.pockethive.phased.marker.AmbientValueProvider;
import io.pockethive.phased.marker.MarkerEmitter;
import io.pockethive.phased.marker.SecondPassResolver;
import io.pockethive.phased.snapshot.SnapshotCapture;
import io.pockethive.phased.snapshot.SnapshotCodec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the two-pass protocol.
 * <p>
 * {@link #render} runs the first pass: phased blocks become markers and {@code phasedcache}
 * fragments are served from the {@link FragmentCache}. {@link #resolve} runs the second pass over
 * composed output. {@link #renderFully} does both, which is what a caller without an intermediate
 * cache layer usually wants.
 * <pre>
 * PhasedTemplateEngine engine = PhasedTemplateEngine.builder()
 *     .config(PhasedConfig.builder().secret("s3cr3t").build())
 *     .build();
 * String page = engine.renderFully(template, Map.of("user", user));
 * </pre>
 */
public final class PhasedTemplateEngine implements TemplateRenderer {

    private final PhasedConfig config;
    private final SecondPassResolver resolver;
    private final FragmentCache fragmentCache;
    private final PebbleTemplateRenderer renderer;

    private PhasedTemplateEngine(Builder builder) {
        this.config = builder.config;
        SnapshotCodec codec = new SnapshotCodec();
        SnapshotCapture capture = new SnapshotCapture(codec, config.refetchNames());
        MarkerEmitter emitter = new MarkerEmitter(config.delimiter(), codec);
        this.resolver = new SecondPassResolver(config, codec, this, builder.ambientValueProvider);
        this.fragmentCache = new FragmentCache(
            builder.fragmentStore, resolver, config.cacheKeyPrefix(), builder.meterRegistry);

        List<Extension> extensions = new ArrayList<>(builder.extensions);
        extensions.add(new PhasedPebbleExtension(capture, emitter, config.keepContext(), fragmentCache));
        PebbleEngine engine = new PebbleEngine.Builder()
            .extension(extensions.toArray(new Extension[0]))
            .autoEscaping(builder.autoEscaping)
            .strictVariables(builder.strictVariables)
            .cacheActive(true)
            .build();
        this.renderer = new PebbleTemplateRenderer(engine);
    }

    public static PhasedTemplateEngine createDefault() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * First pass.
     */
    @Override
    public String render(String templateSource, Map<String, Object> context) {
        return renderer.render(templateSource, context);
    }

    @Override
    public String render(String templateSource, RenderContext context) {
        return renderer.render(templateSource, context);
    }

    /**
     * Second pass over composed first-pass output.
     */
    public String resolve(String text, RenderContext ambient) {
        return resolver.resolve(text, ambient);
    }

    public String resolve(String text, Map<String, Object> ambient) {
        return resolve(text, ambient == null ? RenderContext.empty() : RenderContext.of(ambient));
    }

    public String renderFully(String templateSource, Map<String, Object> context) {
        return renderFully(templateSource, context == null ? RenderContext.empty() : RenderContext.of(context));
    }

    public String renderFully(String templateSource, RenderContext context) {
        return resolve(render(templateSource, context), context);
    }

    public FragmentCache fragmentCache() {
        return fragmentCache;
    }

    public PhasedConfig config() {
        return config;
    }

    public static final class Builder {
        private PhasedConfig config;
        private FragmentCacheStore fragmentStore;
        private AmbientValueProvider ambientValueProvider = AmbientValueProvider.CONTEXT;
        private MeterRegistry meterRegistry;
        private boolean autoEscaping;
        private boolean strictVariables;
        private final List<Extension> extensions = new ArrayList<>();

        private Builder() {
        }

        public Builder config(PhasedConfig config) {
            this.config = config;
            return this;
        }

        public Builder fragmentStore(FragmentCacheStore fragmentStore) {
            this.fragmentStore = fragmentStore;
            return this;
        }

        public Builder ambientValueProvider(AmbientValueProvider ambientValueProvider) {
            this.ambientValueProvider = ambientValueProvider;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /**
         * HTML auto-escaping of Pebble output. Off by default; markers are always written raw.
         */
        public Builder autoEscaping(boolean autoEscaping) {
            this.autoEscaping = autoEscaping;
            return this;
        }

        public Builder strictVariables(boolean strictVariables) {
            this.strictVariables = strictVariables;
            return this;
        }

        public Builder extension(Extension extension) {
            this.extensions.add(Objects.requireNonNull(extension, "extension"));
            return this;
        }

        public PhasedTemplateEngine build() {
            if (config == null) {
                config = PhasedConfig.defaults();
            }
            if (fragmentStore == null) {
                fragmentStore = new InMemoryFragmentCacheStore();
            }
            if (ambientValueProvider == null) {
                ambientValueProvider = AmbientValueProvider.CONTEXT;
            }
            if (meterRegistry == null) {
                meterRegistry = new SimpleMeterRegistry();
            }
            return new PhasedTemplateEngine(this);
        }
    }
}
