package com.questrail.dagcbor.time;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic wall clock for tests.
 *
 * - Starts at the given microsecond reading
 * - Changes only when explicitly instructed
 * - May be set backwards, like a real wall clock after an NTP step
 */
public final class ManualWallClock implements WallClock {

    private final AtomicLong nowMicros;

    public ManualWallClock(long startMicros) {
        this.nowMicros = new AtomicLong(startMicros);
    }

    @Override
    public Instant now() {
        long micros = nowMicros.get();
        return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
    }

    @Override
    public long nowMicros() {
        return nowMicros.get();
    }

    public void advanceMicros(long deltaMicros) {
        if (deltaMicros < 0) {
            throw new IllegalArgumentException("Use setMicros to move the clock backwards");
        }
        nowMicros.addAndGet(deltaMicros);
    }

    public void setMicros(long micros) {
        nowMicros.set(micros);
    }
}
