package com.questrail.dagcbor.observability;

import com.questrail.dagcbor.codec.DagCborDecodeException;

import java.time.Instant;

/**
 * Record describing input the decoder refused.
 */
public record DecodeRejectedEvent(
    Instant timestamp,
    DagCborDecodeException.Kind kind,
    long offset,
    String path,
    String message
) {
    public static DecodeRejectedEvent of(Instant timestamp, DagCborDecodeException e) {
        return new DecodeRejectedEvent(timestamp, e.kind(), e.offset(), e.path(), e.detail());
    }
}
