package com.jreinhal.compass.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pre-built prompt sections keyed by namespace. Entries are replaced when their schema is
 * regenerated, so there is no time-based expiry.
 */
@Configuration
public class PromptCacheConfig {
    @Bean
    public Cache<String, String> schemaPromptCache(@Value("${compass.pipeline.prompt-cache-size:500}") long maximumSize) {
        return Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .recordStats()
            .build();
    }
}
