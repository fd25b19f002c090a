package com.hwsc.userservice.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hwsc.userservice.entity.Secret;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfig {

    /** Key of the single entry held by the active-secret cache. */
    public static final String ACTIVE_SECRET = "activeSecret";

    /**
     * Process-local copy of the active secret row.
     * - One entry only
     * - Short TTL so a row rewritten by another writer is picked up again
     * - Expiry of the secret itself is still checked on every read by SecretServiceImpl
     */
    @Bean
    public Cache<String, Secret> activeSecretCache(
            @Value("${user-service.secret.cache-ttl:PT5M}") Duration ttl) {
        return Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
    }
}
