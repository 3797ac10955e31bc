package com.taskhub.modules.upload.ratelimit;

import java.time.Duration;

/**
 * The five ceilings an upload is admitted against.
 */
public enum RateLimitWindow {
    UPLOADS_PER_MINUTE(Duration.ofMinutes(1), "minute"),
    UPLOADS_PER_HOUR(Duration.ofHours(1), "hour"),
    UPLOADS_PER_DAY(Duration.ofDays(1), "day"),
    BYTES_PER_HOUR(Duration.ofHours(1), "hour"),
    BYTES_PER_DAY(Duration.ofDays(1), "day");

    private final Duration length;
    private final String unit;

    RateLimitWindow(Duration length, String unit) {
        this.length = length;
        this.unit = unit;
    }

    public Duration getLength() {
        return length;
    }

    public String getUnit() {
        return unit;
    }
}
