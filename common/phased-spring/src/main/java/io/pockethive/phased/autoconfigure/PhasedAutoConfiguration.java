package io.pockethive.phased.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import io.pockethive.phased.cache.FragmentCacheStore;
import io.pockethive.phased.config.PhasedConfig;
import io.pockethive.phased.marker.AmbientValueProvider;
import io.pockethive.phased.templating.PhasedTemplateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Auto-configuration for phased template rendering.
 */
@AutoConfiguration(afterName = {
    "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@ConditionalOnClass(PhasedTemplateEngine.class)
@EnableConfigurationProperties(PhasedProperties.class)
@Import({RedisFragmentStoreConfiguration.class, InMemoryFragmentStoreConfiguration.class})
public class PhasedAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PhasedAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PhasedConfig phasedConfig(PhasedProperties properties) {
        if (properties.getDelimiter() == null && properties.getSecret() == null) {
            log.warn("Neither pockethive.phased.delimiter nor pockethive.phased.secret is set; "
                + "phased markers will only resolve inside this instance");
        }
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public AmbientValueProvider phasedAmbientValueProvider() {
        return AmbientValueProvider.CONTEXT;
    }

    @Bean
    @ConditionalOnMissingBean
    public PhasedTemplateEngine phasedTemplateEngine(
        PhasedConfig config,
        PhasedProperties properties,
        FragmentCacheStore fragmentCacheStore,
        AmbientValueProvider ambientValueProvider,
        ObjectProvider<MeterRegistry> meterRegistry
    ) {
        log.info("Phased templates use {} fragment storage", fragmentCacheStore.getClass().getSimpleName());
        return PhasedTemplateEngine.builder()
            .config(config)
            .fragmentStore(fragmentCacheStore)
            .ambientValueProvider(ambientValueProvider)
            .meterRegistry(meterRegistry.getIfAvailable())
            .autoEscaping(properties.isAutoEscaping())
            .build();
    }
}
