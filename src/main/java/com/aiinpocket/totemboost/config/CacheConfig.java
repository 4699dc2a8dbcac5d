package com.aiinpocket.totemboost.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 快取配置。
 * 使用 Caffeine 本地快取加持設定快照（每次加持都會讀取，管理員修改時整批失效）。
 * TTL 1 分鐘，讓多個 Pod 之間的設定差異最多維持 1 分鐘。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String BOOST_SETTINGS_CACHE = "boostSettings";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(BOOST_SETTINGS_CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.MINUTES)
                .maximumSize(1));
        return manager;
    }
}
