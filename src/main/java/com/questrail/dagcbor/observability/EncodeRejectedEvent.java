package com.questrail.dagcbor.observability;

import com.questrail.dagcbor.codec.DagCborEncodeException;

import java.time.Instant;

/**
 * Record describing a value the encoder refused.
 */
public record EncodeRejectedEvent(
    Instant timestamp,
    DagCborEncodeException.Kind kind,
    String path,
    String message
) {
    public static EncodeRejectedEvent of(Instant timestamp, DagCborEncodeException e) {
        return new EncodeRejectedEvent(timestamp, e.kind(), e.path(), e.detail());
    }
}
