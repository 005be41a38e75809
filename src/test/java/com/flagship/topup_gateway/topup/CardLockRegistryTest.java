package com.flagship.topup_gateway.topup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CardLockRegistryTest {

    @Test
    @DisplayName("same card number always maps to the same lock")
    void stableStripe() {
        CardLockRegistry registry = new CardLockRegistry(8);

        assertSame(registry.lockFor("4111111111111111"), registry.lockFor("4111111111111111"));
    }

    @Test
    @DisplayName("lock is held during the action and released afterwards, also on failure")
    void releasesLock() {
        CardLockRegistry registry = new CardLockRegistry(8);
        String card = "4111111111111111";

        assertTrue(registry.withCardLock(card, () -> registry.lockFor(card).isHeldByCurrentThread()));
        assertThrows(IllegalStateException.class, () -> registry.withCardLock(card, () -> {
            throw new IllegalStateException("boom");
        }));
        assertFalse(registry.lockFor(card).isLocked());
    }

    @Test
    @DisplayName("read-modify-write under the lock loses no updates")
    void serializesUpdates() throws Exception {
        CardLockRegistry registry = new CardLockRegistry(4);
        int[] balance = {0};
        int threads = 8;
        int rounds = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger failures = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < rounds; i++) {
                        registry.withCardLock("4111111111111111", () -> {
                            int current = balance[0];
                            Thread.yield();
                            balance[0] = current + 1;
                            return null;
                        });
                    }
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(0, failures.get());
        assertEquals(threads * rounds, balance[0]);
    }

    @Test
    @DisplayName("stripe count must be positive")
    void rejectsInvalidStripeCount() {
        assertThrows(IllegalArgumentException.class, () -> new CardLockRegistry(0));
    }
}
