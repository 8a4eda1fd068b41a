package com.github.dimitryivaniuta.gateway.jobs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.JobResponse;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.LoggingCacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Redis cache is an optimization only; Postgres is the source of truth for job state. Only terminal job
 * views are cached since they never change. Cache failures are logged and the call falls through to the DB.</p>
 */
@Configuration
public class CacheConfig implements CachingConfigurer {

    /**
     * Cache name for terminal job snapshots.
     */
    public static final String JOB_CACHE = "jobSnapshot";

    /**
     * Cache manager using Redis with JSON serialization. Tests and local runs set {@code spring.cache.type=none}.
     *
     * @param factory      redis connection factory
     * @param objectMapper object mapper used for JSON serialization
     * @return cache manager
     */
    @Bean
    @ConditionalOnProperty(prefix = "spring.cache", name = "type", havingValue = "redis")
    public RedisCacheManager cacheManager(RedisConnectionFactory factory, ObjectMapper objectMapper) {
        var typedSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, JobResponse.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var jobCfg = defaultCfg
                .entryTtl(Duration.ofHours(1))
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(typedSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(JOB_CACHE, jobCfg)
                .build();
    }

    @Override
    public CacheErrorHandler errorHandler() {
        return new LoggingCacheErrorHandler();
    }
}
