package com.relay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.cache.InMemoryResponseCache;
import com.relay.cache.RedisResponseCache;
import com.relay.cache.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "relay.cache.type", havingValue = "memory", matchIfMissing = true)
    public ResponseCache inMemoryResponseCache() {
        log.info("Using in-memory response cache");
        return new InMemoryResponseCache();
    }

    @Bean
    @ConditionalOnProperty(name = "relay.cache.type", havingValue = "redis")
    public ResponseCache redisResponseCache(StringRedisTemplate redisTemplate,
                                            ObjectMapper objectMapper,
                                            RelayProperties properties) {
        log.info("Using Redis response cache with key prefix '{}'", properties.getCache().getKeyPrefix());
        return new RedisResponseCache(redisTemplate, objectMapper, properties.getCache().getKeyPrefix());
    }
}
