package com.taskhub.modules.upload.ratelimit;

import com.taskhub.config.UploadProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class UploadRateLimiterTest {

    private static final long MB = UploadProperties.MIB;
    private static final long USER = 7L;

    private MutableClock clock;
    private UploadRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        limiter = new UploadRateLimiter(new UploadProperties(), clock);
    }

    // ================================================================
    // Count windows
    // ================================================================

    @Test
    @DisplayName("10 uploads in a minute → 11th rejected by the per-minute window")
    void eleventhUploadInMinuteRejected() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.check(USER, MB).allowed(), "upload " + (i + 1));
            limiter.record(USER, MB);
            clock.advance(Duration.ofSeconds(1));
        }

        RateLimitDecision decision = limiter.check(USER, MB);

        assertFalse(decision.allowed());
        assertEquals(RateLimitWindow.UPLOADS_PER_MINUTE, decision.window());
        assertEquals("Upload rate limit exceeded: 10 uploads per minute", decision.reason());
    }

    @Test
    @DisplayName("Minute window slides → admitted again after 60 seconds")
    void minuteWindowSlides() {
        for (int i = 0; i < 10; i++) {
            limiter.record(USER, MB);
        }
        assertFalse(limiter.check(USER, MB).allowed());

        clock.advance(Duration.ofSeconds(60));

        assertTrue(limiter.check(USER, MB).allowed());
    }

    @Test
    @DisplayName("50 uploads spread over an hour → per-hour window rejects")
    void hourlyCountRejected() {
        for (int i = 0; i < 50; i++) {
            limiter.record(USER, 1);
            clock.advance(Duration.ofSeconds(70));
        }

        RateLimitDecision decision = limiter.check(USER, 1);

        assertFalse(decision.allowed());
        assertEquals(RateLimitWindow.UPLOADS_PER_HOUR, decision.window());
    }

    // ================================================================
    // Volume windows
    // ================================================================

    @Test
    @DisplayName("95 MB in the last hour + 6 MB candidate → per-hour volume rejects")
    void hourlyVolumeRejected() {
        limiter.record(USER, 95 * MB);

        RateLimitDecision decision = limiter.check(USER, 6 * MB);

        assertFalse(decision.allowed());
        assertEquals(RateLimitWindow.BYTES_PER_HOUR, decision.window());
        assertEquals("Size limit exceeded: 100MB per hour", decision.reason());
    }

    @Test
    @DisplayName("Exactly reaching the hourly volume ceiling → allowed")
    void volumeCeilingInclusive() {
        limiter.record(USER, 95 * MB);

        assertTrue(limiter.check(USER, 5 * MB).allowed());
    }

    @Test
    @DisplayName("Hourly volume frees up after an hour but daily volume still counts")
    void dailyVolumeOutlivesHourlyWindow() {
        for (int i = 0; i < 5; i++) {
            limiter.record(USER, 99 * MB);
            clock.advance(Duration.ofMinutes(61));
        }

        RateLimitDecision decision = limiter.check(USER, 10 * MB);

        assertFalse(decision.allowed());
        assertEquals(RateLimitWindow.BYTES_PER_DAY, decision.window());
    }

    @Test
    @DisplayName("Check never consumes quota")
    void checkIsSideEffectFree() {
        for (int i = 0; i < 20; i++) {
            assertTrue(limiter.check(USER, MB).allowed());
        }
    }

    @Test
    @DisplayName("Users have independent windows")
    void usersAreIndependent() {
        for (int i = 0; i < 10; i++) {
            limiter.record(USER, MB);
        }

        assertFalse(limiter.check(USER, MB).allowed());
        assertTrue(limiter.check(USER + 1, MB).allowed());
    }

    // ================================================================
    // Reservations
    // ================================================================

    @Test
    @DisplayName("Released reservation → quota restored")
    void releaseRestoresQuota() {
        for (int i = 0; i < 9; i++) {
            limiter.record(USER, MB);
        }
        RateLimitDecision reserved = limiter.reserve(USER, MB);
        assertTrue(reserved.allowed());
        assertFalse(limiter.check(USER, MB).allowed());

        reserved.reservation().release();

        assertTrue(limiter.check(USER, MB).allowed());
    }

    @Test
    @DisplayName("Committed reservation counts its actual size, later release is ignored")
    void commitUsesActualSize() {
        RateLimitDecision reserved = limiter.reserve(USER, 10 * MB);
        assertTrue(reserved.reservation().commit(99 * MB).allowed());
        reserved.reservation().release();

        RateLimitDecision decision = limiter.check(USER, 2 * MB);

        assertFalse(decision.allowed());
        assertEquals(RateLimitWindow.BYTES_PER_HOUR, decision.window());
    }

    @Test
    @DisplayName("Commit larger than reserved and over the hourly volume → denied, slot released afterwards")
    void oversizedCommitIsRechecked() {
        RateLimitDecision reserved = limiter.reserve(USER, 1);

        RateLimitDecision settled = reserved.reservation().commit(101 * MB);

        assertFalse(settled.allowed());
        assertEquals(RateLimitWindow.BYTES_PER_HOUR, settled.window());
        assertEquals("Size limit exceeded: 100MB per hour", settled.reason());

        reserved.reservation().release();
        assertTrue(limiter.check(USER, 100 * MB).allowed());
    }

    @Test
    @DisplayName("Denied reservation holds nothing")
    void deniedReservationHoldsNothing() {
        RateLimitDecision decision = limiter.reserve(USER, 101 * MB);

        assertFalse(decision.allowed());
        assertTrue(decision.heldReservation().isEmpty());
    }

    @Test
    @DisplayName("Concurrent reservations for one user never exceed the per-minute limit")
    void concurrentReservationsAreAtomic() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return limiter.reserve(USER, 1).allowed();
            }));
        }
        start.countDown();

        int admitted = 0;
        for (Future<Boolean> result : results) {
            if (result.get(10, TimeUnit.SECONDS)) {
                admitted++;
            }
        }
        pool.shutdown();

        assertEquals(10, admitted);
    }

    // ================================================================
    // Eviction
    // ================================================================

    @Test
    @DisplayName("Identity idle for 24 hours → evicted, active identity kept")
    void evictIdleDropsOnlyIdleIdentities() {
        limiter.record(USER, MB);
        clock.advance(Duration.ofHours(23));
        limiter.record(USER + 1, MB);
        clock.advance(Duration.ofHours(1));

        assertEquals(1, limiter.evictIdle());
        assertEquals(1, limiter.trackedIdentities());
        assertTrue(limiter.check(USER, MB).allowed());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
