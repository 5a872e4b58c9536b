package io.pockethive.phased.autoconfigure;

import io.pockethive.phased.cache.FragmentCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(name = "org.springframework.data.redis.core.StringRedisTemplate")
class RedisFragmentStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(FragmentCacheStore.class)
    @ConditionalOnBean(StringRedisTemplate.class)
    @ConditionalOnExpression("'${pockethive.phased.cache.store:auto}'.toLowerCase() != 'memory'")
    FragmentCacheStore phasedFragmentCacheStore(StringRedisTemplate redis) {
        return new RedisFragmentCacheStore(redis);
    }
}
