package com.tempchan.security;

import com.tempchan.config.TempchanProperties;
import com.tempchan.error.RateLimitException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CreationRateLimiterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private CreationRateLimiter limiter;

    @BeforeEach
    void setUp() {
        TempchanProperties properties = new TempchanProperties();
        properties.getRateLimit().setMaxChannelsPerUser(2);
        properties.getRateLimit().setCreationCooldown(Duration.ofMinutes(5));
        limiter = new CreationRateLimiter(properties);
    }

    @Test
    void commitMovesPendingToActive() {
        CreationRateLimiter.Reservation reservation = limiter.tryReserve("u1", NOW);
        assertEquals(1, limiter.snapshot("u1").pendingCount());

        reservation.commit(NOW);

        CreationRateLimiter.RateLimitRecord record = limiter.snapshot("u1");
        assertEquals(1, record.activeCount());
        assertEquals(0, record.pendingCount());
        assertEquals(NOW, record.lastCreationAt());
    }

    @Test
    void releaseLeavesNoTrace() {
        CreationRateLimiter.Reservation reservation = limiter.tryReserve("u1", NOW);
        reservation.release();
        reservation.commit(NOW);

        assertEquals(new CreationRateLimiter.RateLimitRecord(0, 0, null), limiter.snapshot("u1"));
        assertDoesNotThrow(() -> limiter.tryReserve("u1", NOW));
    }

    @Test
    void cooldownAppliesBetweenCreations() {
        limiter.tryReserve("u1", NOW).commit(NOW);

        RateLimitException denied = assertThrows(RateLimitException.class,
                () -> limiter.tryReserve("u1", NOW.plus(Duration.ofMinutes(4))));
        assertEquals(RateLimitException.Reason.COOLDOWN_ACTIVE, denied.reason());
        assertEquals("You're on cooldown! Wait 5 minutes between channel creations.", denied.getMessage());

        assertDoesNotThrow(() -> limiter.tryReserve("u1", NOW.plus(Duration.ofMinutes(5))));
    }

    @Test
    void maxChannelsIsCheckedBeforeCooldown() {
        limiter.tryReserve("u1", NOW).commit(NOW);
        Instant later = NOW.plus(Duration.ofMinutes(10));
        limiter.tryReserve("u1", later).commit(later);

        RateLimitException denied = assertThrows(RateLimitException.class,
                () -> limiter.tryReserve("u1", later));
        assertEquals(RateLimitException.Reason.MAX_CHANNELS_REACHED, denied.reason());
        assertEquals(2, limiter.snapshot("u1").activeCount());
    }

    @Test
    void releasingActiveFreesASlot() {
        limiter.tryReserve("u1", NOW).commit(NOW);
        Instant later = NOW.plus(Duration.ofMinutes(10));
        limiter.tryReserve("u1", later).commit(later);

        limiter.releaseActive("u1");

        assertEquals(1, limiter.snapshot("u1").activeCount());
        assertDoesNotThrow(() -> limiter.tryReserve("u1", later.plus(Duration.ofMinutes(5))));
    }

    @Test
    void releaseActiveNeverGoesNegative() {
        limiter.releaseActive("nobody");
        limiter.tryReserve("u1", NOW).commit(NOW);
        limiter.releaseActive("u1");
        limiter.releaseActive("u1");

        assertEquals(0, limiter.snapshot("u1").activeCount());
        assertEquals(0, limiter.snapshot("nobody").activeCount());
    }

    @Test
    void concurrentReservationsGrantOnlyOne() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        Callable<Boolean> attempt = () -> {
            go.await();
            try {
                limiter.tryReserve("u1", NOW);
                return true;
            } catch (RateLimitException e) {
                return false;
            }
        };

        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(attempt));
        }
        go.countDown();

        int granted = 0;
        for (Future<Boolean> f : futures) {
            if (f.get(5, TimeUnit.SECONDS)) granted++;
        }
        pool.shutdown();

        assertEquals(1, granted);
        assertEquals(1, limiter.snapshot("u1").pendingCount());
    }

    @Test
    void clearForgetsEveryone() {
        limiter.tryReserve("u1", NOW).commit(NOW);
        limiter.clear();
        assertEquals(0, limiter.snapshot("u1").activeCount());
    }
}
