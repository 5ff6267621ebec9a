package com.sharesgate.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for community (bot) lookups. Evicted on registration.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String COMMUNITY_BY_SUBJECT_CACHE = "communityBySubjectCache";
    public static final String COMMUNITY_BY_CHAT_CACHE = "communityByChatCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(COMMUNITY_BY_SUBJECT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(5_000)
                .build());
        manager.registerCustomCache(COMMUNITY_BY_CHAT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
