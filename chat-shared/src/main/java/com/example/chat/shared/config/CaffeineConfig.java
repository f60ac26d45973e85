package com.example.chat.shared.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CaffeineConfig {

    /**
     * Directed block lookups keyed by "blocker|blocked". Writes through the registry
     * invalidate the affected key, so the expiry only bounds staleness for rows
     * changed directly in the database.
     */
    @Bean
    public Cache<String, Boolean> blockLookupCache(AppProperties appProperties) {
        AppProperties.Cache.BlockLookups settings = appProperties.getCache().getBlockLookups();
        return Caffeine.newBuilder()
                .maximumSize(settings.getMaximumSize())
                .expireAfterWrite(settings.getExpireAfterWrite())
                .recordStats()
                .build();
    }
}
