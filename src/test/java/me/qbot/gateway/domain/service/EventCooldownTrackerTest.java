package me.qbot.gateway.domain.service;

import me.qbot.gateway.domain.model.ResolutionContext;
import me.qbot.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCooldownTrackerTest {

    private static final String EVENT = "repeat";
    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private AtomicInteger draws;
    private double nextDraw;
    private EventCooldownTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        draws = new AtomicInteger();
        nextDraw = 0.0;
        tracker = new EventCooldownTracker(clock, () -> {
            draws.incrementAndGet();
            return nextDraw;
        });
    }

    private static ResolutionContext groupUser(String userId) {
        return ResolutionContext.group("100", userId);
    }

    // ===== Personal cooldown =====

    @Test
    void shouldBlockWithinPersonalInterval() {
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 60, 0));

        clock.advance(Duration.ofSeconds(30));
        assertFalse(tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 60, 0));

        clock.advance(Duration.ofSeconds(31));
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 60, 0));
    }

    @Test
    void shouldTrackPersonalCooldownPerUser() {
        tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 60, 0);

        assertTrue(tracker.tryTrigger(EVENT, groupUser("u2"), 1.0, 60, 0));
    }

    @Test
    void shouldNotDrawWhileBlocked() {
        tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 60, 0);
        int before = draws.get();

        tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 60, 0);

        assertEquals(before, draws.get());
    }

    @Test
    void shouldNotStampWhenDrawFails() {
        nextDraw = 0.9;

        assertFalse(tracker.tryTrigger(EVENT, groupUser("u1"), 0.5, 60, 0));

        assertNull(tracker.lastPersonalTrigger(EVENT, "u1"));
        nextDraw = 0.1;
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u1"), 0.5, 60, 0));
    }

    @Test
    void shouldAllowEveryMessageWithZeroInterval() {
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 0, 0));
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 0, 0));
    }

    // ===== Shared cooldown =====

    @Test
    void shouldShareCooldownAcrossGroupMembers() {
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, -1, 60));

        assertFalse(tracker.tryTrigger(EVENT, groupUser("u2"), 1.0, -1, 60));
        assertTrue(tracker.tryTrigger(EVENT, ResolutionContext.group("200", "u2"), 1.0, -1, 60));

        clock.advance(Duration.ofSeconds(60));
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u2"), 1.0, -1, 60));
        assertNotNull(tracker.lastSharedTrigger(EVENT, "100"));
        assertNull(tracker.lastPersonalTrigger(EVENT, "u2"));
    }

    @Test
    void shouldSkipSharedGateInPrivateScope() {
        ResolutionContext privateChat = ResolutionContext.privateChat("u1");

        assertTrue(tracker.tryTrigger(EVENT, privateChat, 1.0, -1, 60));
        assertTrue(tracker.tryTrigger(EVENT, privateChat, 1.0, -1, 60));
    }

    @Test
    void shouldSkipSharedGateWhenSharedIntervalIsZero() {
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, -1, 0));
        assertTrue(tracker.tryTrigger(EVENT, groupUser("u2"), 1.0, -1, 0));
    }

    @Test
    void shouldFireSharedEventOnceUnderConcurrentMessages() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String userId = "u" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    return tracker.tryTrigger(EVENT, groupUser(userId), 1.0, -1, 600);
                }));
            }
            start.countDown();
            int fired = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    fired++;
                }
            }
            assertEquals(1, fired);
        } finally {
            executor.shutdownNow();
        }
    }

    // ===== Eviction =====

    @Test
    void shouldEvictStampsOlderThanLongestInterval() {
        tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 60, 0);
        clock.advance(Duration.ofSeconds(30));
        tracker.tryTrigger(EVENT, groupUser("u2"), 1.0, 120, 0);

        clock.advance(Duration.ofSeconds(100));
        tracker.tryTrigger("other", groupUser("u3"), 1.0, 0, 0);

        assertNull(tracker.lastPersonalTrigger(EVENT, "u1"));
        assertNotNull(tracker.lastPersonalTrigger(EVENT, "u2"));
    }

    // ===== Probability =====

    @Test
    void shouldNeverFireWithZeroProbability() {
        nextDraw = 0.0;

        assertFalse(tracker.tryTrigger(EVENT, groupUser("u1"), 0.0, 0, 0));
    }

    @Test
    void shouldClearStateOnReset() {
        tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 3600, 0);

        tracker.reset();

        assertTrue(tracker.tryTrigger(EVENT, groupUser("u1"), 1.0, 3600, 0));
    }
}
