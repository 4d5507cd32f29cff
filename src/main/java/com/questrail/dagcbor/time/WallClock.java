package com.questrail.dagcbor.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock time source.
 *
 * <p>
 * Used for observability timestamps and as the time base of
 * {@code TidClock}. This clock may jump due to NTP adjustments or explicit time
 * setting; consumers that need monotonic output must enforce it themselves.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();

    /**
     * Returns the current time as microseconds since the Unix epoch.
     */
    default long nowMicros() {
        Instant t = now();
        return Math.addExact(Math.multiplyExact(t.getEpochSecond(), 1_000_000L), t.getNano() / 1_000L);
    }
}
