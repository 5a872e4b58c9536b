package io.pockethive.phased.autoconfigure;

import io.pockethive.phased.cache.FragmentCacheStore;
import io.pockethive.phased.cache.InMemoryFragmentCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
class InMemoryFragmentStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(FragmentCacheStore.class)
    FragmentCacheStore phasedFragmentCacheStore(PhasedProperties properties) {
        if (properties.getCache().getStore() == PhasedProperties.Store.REDIS) {
            throw new IllegalStateException(
                "pockethive.phased.cache.store=redis requires a StringRedisTemplate bean");
        }
        return new InMemoryFragmentCacheStore();
    }
}
