package com.taskhub.modules.upload.ratelimit;

import java.util.Optional;

/**
 * Outcome of an admission check.
 *
 * @param allowed     whether the candidate upload fits every window
 * @param window      the first ceiling that would be exceeded, or {@code null}
 * @param reason      human-readable rejection reason, or {@code null}
 * @param reservation held slot when produced by {@code reserve}, else {@code null}
 */
public record RateLimitDecision(boolean allowed,
        RateLimitWindow window,
        String reason,
        QuotaReservation reservation) {

    static RateLimitDecision allow() {
        return new RateLimitDecision(true, null, null, null);
    }

    static RateLimitDecision allow(QuotaReservation reservation) {
        return new RateLimitDecision(true, null, null, reservation);
    }

    static RateLimitDecision deny(RateLimitWindow window, String reason) {
        return new RateLimitDecision(false, window, reason, null);
    }

    public Optional<QuotaReservation> heldReservation() {
        return Optional.ofNullable(reservation);
    }
}
