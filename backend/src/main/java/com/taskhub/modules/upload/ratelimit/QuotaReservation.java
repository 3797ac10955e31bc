package com.taskhub.modules.upload.ratelimit;

/**
 * A slot taken in an identity's upload quota by
 * {@link UploadRateLimiter#reserve(long, long)}. Once a commit is allowed or
 * the slot is released, later calls are ignored.
 */
public interface QuotaReservation {

    /**
     * Keep the slot, replacing the provisional size with the measured one.
     * A size larger than the reserved one is re-checked against the byte
     * volume windows; when denied the slot stays pending and the caller must
     * {@link #release()} it.
     */
    RateLimitDecision commit(long actualSize);

    /** Give the slot back; the upload never happened. */
    void release();
}
