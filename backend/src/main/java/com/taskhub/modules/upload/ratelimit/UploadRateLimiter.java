package com.taskhub.modules.upload.ratelimit;

import com.taskhub.config.UploadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;

/**
 * Per-user sliding-window limiter over upload count (minute/hour/day) and
 * byte volume (hour/day).
 * <p>
 * State is in-memory and process-local: several backend instances each
 * enforce their own quota. Each identity's window is guarded by its own
 * monitor, so check-then-record is atomic per user without serializing
 * unrelated users.
 * </p>
 */
@Slf4j
@Component
public class UploadRateLimiter {

    static final long RETENTION_MILLIS = 86_400_000L;
    static final long PRUNE_INTERVAL_MILLIS = 300_000L;
    private static final long HOUR_MILLIS = RateLimitWindow.UPLOADS_PER_HOUR.getLength().toMillis();
    private static final long MINUTE_MILLIS = RateLimitWindow.UPLOADS_PER_MINUTE.getLength().toMillis();

    private final UploadProperties.RateLimit limits;
    private final Clock clock;
    private final ConcurrentMap<Long, IdentityWindow> windows = new ConcurrentHashMap<>();

    public UploadRateLimiter(UploadProperties properties, Clock clock) {
        this.limits = properties.getRateLimit();
        this.clock = clock;
    }

    /**
     * Would an upload of {@code candidateSize} bytes be admitted right now?
     * Does not change any state apart from lazy pruning.
     */
    public RateLimitDecision check(long userId, long candidateSize) {
        return withWindow(userId, (window, now) -> evaluate(userId, window, now, candidateSize));
    }

    /**
     * Count a completed upload against the user's quota.
     */
    public void record(long userId, long actualSize) {
        withWindow(userId, (window, now) -> {
            window.entries.addLast(new UploadEntry(now, actualSize));
            return null;
        });
    }

    /**
     * Check and record in one step. The returned decision carries a
     * {@link QuotaReservation} when allowed; the caller must commit or release it.
     */
    public RateLimitDecision reserve(long userId, long candidateSize) {
        return withWindow(userId, (window, now) -> {
            RateLimitDecision decision = evaluate(userId, window, now, candidateSize);
            if (!decision.allowed()) {
                return decision;
            }
            UploadEntry entry = new UploadEntry(now, candidateSize);
            window.entries.addLast(entry);
            return RateLimitDecision.allow(new EntryReservation(window, entry));
        });
    }

    /**
     * Drop identities with no upload in the last 24 hours.
     *
     * @return number of identities evicted
     */
    public int evictIdle() {
        int evicted = 0;
        for (Map.Entry<Long, IdentityWindow> e : windows.entrySet()) {
            IdentityWindow window = e.getValue();
            synchronized (window) {
                prune(window, clock.millis());
                if (window.entries.isEmpty()) {
                    window.retired = true;
                    if (windows.remove(e.getKey(), window)) {
                        evicted++;
                    }
                }
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit identities", evicted);
        }
        return evicted;
    }

    int trackedIdentities() {
        return windows.size();
    }

    private <T> T withWindow(long userId, BiFunction<IdentityWindow, Long, T> action) {
        while (true) {
            IdentityWindow window = windows.computeIfAbsent(userId, id -> new IdentityWindow(clock.millis()));
            synchronized (window) {
                if (!window.retired) {
                    return action.apply(window, clock.millis());
                }
            }
        }
    }

    private RateLimitDecision evaluate(long userId, IdentityWindow window, long now, long candidateSize) {
        if (now - window.lastPrune > PRUNE_INTERVAL_MILLIS) {
            prune(window, now);
        }

        int lastMinute = 0;
        int lastHour = 0;
        int lastDay = 0;
        long bytesLastHour = 0;
        long bytesLastDay = 0;
        for (UploadEntry entry : window.entries) {
            long age = now - entry.timestamp;
            if (age < RETENTION_MILLIS) {
                lastDay++;
                bytesLastDay += entry.bytes;
            }
            if (age < HOUR_MILLIS) {
                lastHour++;
                bytesLastHour += entry.bytes;
            }
            if (age < MINUTE_MILLIS) {
                lastMinute++;
            }
        }

        RateLimitDecision decision;
        if (lastMinute >= limits.getUploadsPerMinute()) {
            decision = countExceeded(RateLimitWindow.UPLOADS_PER_MINUTE, limits.getUploadsPerMinute());
        } else if (lastHour >= limits.getUploadsPerHour()) {
            decision = countExceeded(RateLimitWindow.UPLOADS_PER_HOUR, limits.getUploadsPerHour());
        } else if (lastDay >= limits.getUploadsPerDay()) {
            decision = countExceeded(RateLimitWindow.UPLOADS_PER_DAY, limits.getUploadsPerDay());
        } else if (bytesLastHour + candidateSize > limits.getTotalSizePerHour()) {
            decision = volumeExceeded(RateLimitWindow.BYTES_PER_HOUR, limits.getTotalSizePerHour());
        } else if (bytesLastDay + candidateSize > limits.getTotalSizePerDay()) {
            decision = volumeExceeded(RateLimitWindow.BYTES_PER_DAY, limits.getTotalSizePerDay());
        } else {
            return RateLimitDecision.allow();
        }

        log.warn("Upload rate limit hit: userId={}, window={}, candidateSize={}",
                userId, decision.window(), candidateSize);
        return decision;
    }

    /**
     * Byte volume check for a pending entry whose real size turned out larger
     * than reserved. The entry itself is left out of the sums.
     */
    private RateLimitDecision checkVolume(IdentityWindow window, UploadEntry pending, long now, long actualSize) {
        long bytesLastHour = 0;
        long bytesLastDay = 0;
        for (UploadEntry entry : window.entries) {
            if (entry == pending) {
                continue;
            }
            long age = now - entry.timestamp;
            if (age < RETENTION_MILLIS) {
                bytesLastDay += entry.bytes;
            }
            if (age < HOUR_MILLIS) {
                bytesLastHour += entry.bytes;
            }
        }

        RateLimitDecision decision;
        if (bytesLastHour + actualSize > limits.getTotalSizePerHour()) {
            decision = volumeExceeded(RateLimitWindow.BYTES_PER_HOUR, limits.getTotalSizePerHour());
        } else if (bytesLastDay + actualSize > limits.getTotalSizePerDay()) {
            decision = volumeExceeded(RateLimitWindow.BYTES_PER_DAY, limits.getTotalSizePerDay());
        } else {
            return RateLimitDecision.allow();
        }
        log.warn("Upload larger than reserved exceeds quota: window={}, actualSize={}",
                decision.window(), actualSize);
        return decision;
    }

    private static void prune(IdentityWindow window, long now) {
        Deque<UploadEntry> entries = window.entries;
        while (!entries.isEmpty() && now - entries.peekFirst().timestamp >= RETENTION_MILLIS) {
            entries.pollFirst();
        }
        window.lastPrune = now;
    }

    private static RateLimitDecision countExceeded(RateLimitWindow window, int limit) {
        return RateLimitDecision.deny(window,
                "Upload rate limit exceeded: " + limit + " uploads per " + window.getUnit());
    }

    private static RateLimitDecision volumeExceeded(RateLimitWindow window, long limit) {
        return RateLimitDecision.deny(window,
                "Size limit exceeded: " + (limit / UploadProperties.MIB) + "MB per " + window.getUnit());
    }

    private static final class IdentityWindow {
        private final Deque<UploadEntry> entries = new ArrayDeque<>();
        private long lastPrune;
        private boolean retired;

        private IdentityWindow(long createdAt) {
            this.lastPrune = createdAt;
        }
    }

    /** Compared by identity, so a reservation removes exactly its own entry. */
    private static final class UploadEntry {
        private final long timestamp;
        private long bytes;

        private UploadEntry(long timestamp, long bytes) {
            this.timestamp = timestamp;
            this.bytes = bytes;
        }
    }

    private final class EntryReservation implements QuotaReservation {
        private final IdentityWindow window;
        private final UploadEntry entry;
        private boolean settled;

        private EntryReservation(IdentityWindow window, UploadEntry entry) {
            this.window = window;
            this.entry = entry;
        }

        @Override
        public RateLimitDecision commit(long actualSize) {
            synchronized (window) {
                if (settled) {
                    return RateLimitDecision.allow();
                }
                if (actualSize > entry.bytes) {
                    RateLimitDecision decision = checkVolume(window, entry, clock.millis(), actualSize);
                    if (!decision.allowed()) {
                        return decision;
                    }
                }
                settled = true;
                entry.bytes = actualSize;
                return RateLimitDecision.allow();
            }
        }

        @Override
        public void release() {
            synchronized (window) {
                if (settled) {
                    return;
                }
                settled = true;
                window.entries.removeFirstOccurrence(entry);
            }
        }
    }
}
