package com.ledgerimport.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Category names per owner change only when budgets are edited; connections only on
 * re-link.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String BUDGET_CATEGORY_CACHE = "budgetCategoryCache";
    public static final String CONNECTION_CACHE = "connectionCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(BUDGET_CATEGORY_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(CONNECTION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(500)
                .build());
        return manager;
    }
}
