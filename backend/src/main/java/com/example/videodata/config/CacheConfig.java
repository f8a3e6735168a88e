package com.example.videodata.config;

import com.example.videodata.cache.InMemoryVideoDataCache;
import com.example.videodata.cache.RedisVideoDataCache;
import com.example.videodata.cache.VideoDataCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the response cache backend via {@code app.cache.type} ({@code memory} or {@code redis}).
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    @ConditionalOnProperty(name = "app.cache.type", havingValue = "redis")
    public VideoDataCache redisVideoDataCache(StringRedisTemplate stringRedisTemplate,
                                              ObjectMapper objectMapper,
                                              @Value("${app.cache.redis.key-prefix:videodata}") String keyPrefix,
                                              @Value("${app.cache.redis.ttl:0s}") Duration ttl) {
        log.info("Using Redis response cache with prefix '{}' and ttl {}", keyPrefix, ttl);
        return new RedisVideoDataCache(stringRedisTemplate, objectMapper, keyPrefix, ttl);
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.type", havingValue = "memory", matchIfMissing = true)
    public VideoDataCache inMemoryVideoDataCache() {
        log.info("Using in-memory response cache");
        return new InMemoryVideoDataCache();
    }
}
