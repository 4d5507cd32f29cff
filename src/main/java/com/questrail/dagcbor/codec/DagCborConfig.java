package com.questrail.dagcbor.codec;

import com.questrail.dagcbor.observability.CodecObservabilitySink;
import com.questrail.dagcbor.observability.NullObservabilitySink;
import com.questrail.dagcbor.time.SystemWallClock;
import com.questrail.dagcbor.time.WallClock;

import java.util.Objects;

/**
 * Aggregated configuration for the default encoder and decoder.
 *
 * @param initialBufferCapacity   starting size of the encoder's output buffer
 * @param maxPreallocatedEntries  upper bound on list/map pre-sizing taken from a
 *                                declared (untrusted) element count
 * @param observabilitySink       receives rejection events
 * @param wallClock               timestamps rejection events
 */
public record DagCborConfig(
    int initialBufferCapacity,
    int maxPreallocatedEntries,
    CodecObservabilitySink observabilitySink,
    WallClock wallClock
) {
    public static final int DEFAULT_INITIAL_BUFFER_CAPACITY = 1024;
    public static final int DEFAULT_MAX_PREALLOCATED_ENTRIES = 1024;

    private static final DagCborConfig DEFAULTS = builder().build();

    public DagCborConfig {
        if (initialBufferCapacity < 1) {
            throw new IllegalArgumentException("initialBufferCapacity must be positive");
        }
        if (maxPreallocatedEntries < 0) {
            throw new IllegalArgumentException("maxPreallocatedEntries must not be negative");
        }
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    public static DagCborConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int initialBufferCapacity = DEFAULT_INITIAL_BUFFER_CAPACITY;
        private int maxPreallocatedEntries = DEFAULT_MAX_PREALLOCATED_ENTRIES;
        private CodecObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withInitialBufferCapacity(int initialBufferCapacity) {
            this.initialBufferCapacity = initialBufferCapacity;
            return this;
        }

        public Builder withMaxPreallocatedEntries(int maxPreallocatedEntries) {
            this.maxPreallocatedEntries = maxPreallocatedEntries;
            return this;
        }

        public Builder withObservabilitySink(CodecObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public DagCborConfig build() {
            return new DagCborConfig(initialBufferCapacity, maxPreallocatedEntries, observabilitySink, wallClock);
        }
    }
}
