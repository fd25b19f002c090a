package com.hwsc.userservice.serviceImpl;

import com.hwsc.userservice.entity.ActiveSecret;
import com.hwsc.userservice.entity.Secret;
import com.hwsc.userservice.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class SecretServiceImplTest extends AbstractIntegrationTest {

    @Test
    void firstReadCreatesAndPersistsActiveSecret() {
        Secret active = secretService.getActive();

        assertNotNull(active.getKey());
        assertEquals(Instant.parse("2024-05-20T03:00:00Z"), active.getExpiresAt());
        ActiveSecret row = activeSecretRepository.findById(ActiveSecret.SLOT).orElseThrow();
        assertEquals(active.getKey(), row.getSecret().getKey());
        assertEquals(1, secretRepository.count());
    }

    @Test
    void twoRotationsProduceDifferentKeysOnTheWeeklyBoundary() {
        Secret first = secretService.rotate();
        clock.set(Instant.parse("2024-05-19T22:00:00Z"));
        Secret second = secretService.rotate();

        assertNotEquals(first.getKey(), second.getKey());
        assertEquals(Instant.parse("2024-05-20T03:00:00Z"), second.getExpiresAt());
        assertTrue(second.getExpiresAt().isAfter(second.getCreatedAt()));
        assertEquals(second.getKey(), secretService.getActive().getKey());
        assertEquals(2, secretRepository.count(), "superseded secrets are kept");
    }

    @Test
    void expiredActiveSecretIsRotatedOnRead() {
        Secret first = secretService.getActive();

        clock.set(Instant.parse("2024-05-20T03:00:00Z"));
        Secret next = secretService.getActive();

        assertNotEquals(first.getKey(), next.getKey());
        assertEquals(Instant.parse("2024-05-27T03:00:00Z"), next.getExpiresAt());
    }

    @Test
    void activeSecretSurvivesCacheLoss() {
        Secret active = secretService.getActive();

        secretService.invalidateCache();

        assertEquals(active.getKey(), secretService.getActive().getKey());
        assertEquals(1, secretRepository.count());
    }

    @Test
    void concurrentFirstReadsRotateOnce() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> keys = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                keys.add(pool.submit(() -> {
                    start.await();
                    return secretService.getActive().getKey();
                }));
            }
            start.countDown();

            Set<String> distinct = new HashSet<>();
            for (Future<String> key : keys) {
                distinct.add(key.get(10, TimeUnit.SECONDS));
            }
            assertEquals(1, distinct.size());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, secretRepository.count());
    }
}
