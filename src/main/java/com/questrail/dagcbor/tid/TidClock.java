package com.questrail.dagcbor.tid;

import com.questrail.dagcbor.observability.CodecObservabilitySink;
import com.questrail.dagcbor.observability.NullObservabilitySink;
import com.questrail.dagcbor.observability.TidClockEvent;
import com.questrail.dagcbor.time.SystemWallClock;
import com.questrail.dagcbor.time.WallClock;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TidClock
 * =============================================================================
 * Issues strictly increasing {@link Tid}s for one clock id.
 *
 * <p>Each call reads the wall clock in microseconds. If the reading is not
 * later than the last issued timestamp (two calls within one microsecond, or
 * the wall clock stepping backwards) the clock issues last + 1 instead and
 * reports the adjustment to the observability sink.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>The last issued timestamp is guarded by a lock, so concurrent callers
 * still observe strictly increasing output. The sink is called outside the
 * lock.</p>
 */
public final class TidClock
{
    private final int clockId;
    private final WallClock wallClock;
    private final CodecObservabilitySink observabilitySink;

    private final ReentrantLock lock = new ReentrantLock();
    private long last;

    public TidClock(int clockId) {
        this(clockId, SystemWallClock.INSTANCE, NullObservabilitySink.INSTANCE);
    }

    public TidClock(int clockId, WallClock wallClock) {
        this(clockId, wallClock, NullObservabilitySink.INSTANCE);
    }

    public TidClock(int clockId, WallClock wallClock, CodecObservabilitySink observabilitySink) {
        if (clockId < 0 || clockId > Tid.CLOCK_ID_MASK) {
            throw new IllegalArgumentException("clockId must be 0-" + Tid.CLOCK_ID_MASK + ": " + clockId);
        }
        this.clockId = clockId;
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public int clockId() {
        return clockId;
    }

    public Tid next() {
        final long observed = wallClock.nowMicros();
        final long issued;

        lock.lock();
        try {
            issued = observed <= last ? last + 1 : observed;
            last = issued;
        } finally {
            lock.unlock();
        }

        if (issued != observed) {
            observabilitySink.onClockAdjusted(new TidClockEvent(clockId, observed, issued));
        }
        return Tid.create(issued, clockId);
    }

    /**
     * Returns the text of {@link #next()}.
     */
    public String now() {
        return next().toString();
    }
}
