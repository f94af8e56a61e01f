package com.jreinhal.covenant.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    /**
     * Query text to embedding. Repeated questions skip the billed provider call.
     */
    @Bean
    public Cache<String, float[]> queryEmbeddingCache(EmbeddingProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(Math.max(1L, properties.getQueryCacheSize()))
                .expireAfterWrite(properties.getQueryCacheTtl())
                .build();
    }
}
