package com.hwsc.userservice.config;

import com.hwsc.userservice.concurrency.IdentityLockRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.security.SecureRandom;
import java.time.Clock;

@Configuration
@EnableScheduling
public class ApplicationConfig {

    /** Every persisted timestamp (account creation, token and secret expiry) is read from this clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    /** One registry per process; torn down with the context (see ServiceLifecycle). */
    @Bean
    public IdentityLockRegistry identityLockRegistry() {
        return new IdentityLockRegistry();
    }
}
