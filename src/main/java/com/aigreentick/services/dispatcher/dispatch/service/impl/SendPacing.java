package com.aigreentick.services.dispatcher.dispatch.service.impl;

import java.time.Duration;

/**
 * Per-sender rate limiting arithmetic.
 */
public final class SendPacing {

    private static final double MIN_INTERVAL_SECONDS = 1.0;

    private SendPacing() {
    }

    /**
     * Seconds between two targets of one sender: {@code max(60 / ratePerMin, 1.0)}.
     */
    public static double intervalSeconds(int ratePerMin) {
        if (ratePerMin <= 0) {
            throw new IllegalArgumentException("ratePerMin must be > 0, got " + ratePerMin);
        }
        return Math.max(60.0 / ratePerMin, MIN_INTERVAL_SECONDS);
    }

    public static Duration interval(int ratePerMin) {
        return Duration.ofNanos(Math.round(intervalSeconds(ratePerMin) * 1_000_000_000L));
    }

    /**
     * Flood-wait sleep: one second more than the provider asked for.
     */
    public static Duration floodWait(int waitSeconds) {
        return Duration.ofSeconds(waitSeconds + 1L);
    }
}
