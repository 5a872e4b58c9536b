package io.pockethive.phased.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pockethive.phased.cache.FragmentCacheStore;
import io.pockethive.phased.cache.InMemoryFragmentCacheStore;
import io.pockethive.phased.config.PhasedConfig;
import io.pockethive.phased.marker.AmbientValueProvider;
import io.pockethive.phased.templating.PhasedTemplateEngine;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.core.StringRedisTemplate;

class PhasedAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(PhasedAutoConfiguration.class));

    @Test
    void registersEngineWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(PhasedTemplateEngine.class);
            assertThat(context).getBean(FragmentCacheStore.class).isInstanceOf(InMemoryFragmentCacheStore.class);
            PhasedConfig config = context.getBean(PhasedConfig.class);
            assertThat(config.keepContext()).isFalse();
            assertThat(config.maxDepth()).isEqualTo(PhasedConfig.DEFAULT_MAX_DEPTH);
            assertThat(config.refetchNames()).containsExactly("csrf_token");
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
            .withPropertyValues(
                "pockethive.phased.delimiter=<!--x-->",
                "pockethive.phased.keep-context=true",
                "pockethive.phased.refetch-names=csrf_token, nonce",
                "pockethive.phased.max-depth=4",
                "pockethive.phased.cache.key-prefix=site.fragments")
            .run(context -> {
                PhasedConfig config = context.getBean(PhasedTemplateEngine.class).config();
                assertThat(config.delimiter()).isEqualTo("<!--x-->");
                assertThat(config.keepContext()).isTrue();
                assertThat(config.refetchNames()).containsExactly("csrf_token", "nonce");
                assertThat(config.maxDepth()).isEqualTo(4);
                assertThat(context.getBean(PhasedTemplateEngine.class).fragmentCache().cacheKey("box", null))
                    .startsWith("site.fragments.box.");
            });
    }

    @Test
    void delimiterIsDerivedFromSecret() {
        contextRunner
            .withPropertyValues("pockethive.phased.secret=shared")
            .run(context -> assertThat(context.getBean(PhasedConfig.class).delimiter())
                .isEqualTo(PhasedConfig.deriveDelimiter("shared")));
    }

    @Test
    void usesRedisWhenTemplateIsAvailable() {
        contextRunner
            .withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class))
            .run(context -> assertThat(context)
                .getBean(FragmentCacheStore.class)
                .isInstanceOf(RedisFragmentCacheStore.class));
    }

    @Test
    void memoryStoreCanBeForced() {
        contextRunner
            .withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class))
            .withPropertyValues("pockethive.phased.cache.store=memory")
            .run(context -> assertThat(context)
                .getBean(FragmentCacheStore.class)
                .isInstanceOf(InMemoryFragmentCacheStore.class));
    }

    @Test
    void redisStoreWithoutTemplateFails() {
        contextRunner
            .withPropertyValues("pockethive.phased.cache.store=redis")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void backsOffForUserBeans() {
        PhasedTemplateEngine custom = PhasedTemplateEngine.createDefault();
        contextRunner
            .withBean(PhasedTemplateEngine.class, () -> custom)
            .run(context -> assertThat(context.getBean(PhasedTemplateEngine.class)).isSameAs(custom));
    }

    @Test
    void engineUsesContextMeterRegistryAndAmbientProvider() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        contextRunner
            .withBean(MeterRegistry.class, () -> registry)
            .withBean(AmbientValueProvider.class, () -> (name, ambient) -> "issued")
            .withPropertyValues("pockethive.phased.delimiter=<!--x-->", "pockethive.phased.keep-context=true")
            .run(context -> {
                PhasedTemplateEngine engine = context.getBean(PhasedTemplateEngine.class);
                String page = engine.renderFully(
                    "{% phasedcache 0 box %}{% phased %}{{ csrf_token }}{% endphased %}{% endphasedcache %}",
                    Map.of("csrf_token", "stale"));

                assertThat(page).isEqualTo("issued");
                assertThat(registry.get("phased.fragment.cache").tag("result", "miss").counter().count())
                    .isEqualTo(1.0);
            });
    }
}
