package com.questrail.dagcbor.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CodecObservabilitySink that emits logs via SLF4J.
 *
 * <p>Rejections are logged at DEBUG, clock adjustments at TRACE.</p>
 */
public final class Slf4jCodecObservabilitySink implements CodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);

    @Override
    public void onDecodeRejected(DecodeRejectedEvent event) {
        log.debug("DAG-CBOR decode rejected ({}) at offset {} {}: {}",
            event.kind(),
            event.offset(),
            event.path(),
            event.message());
    }

    @Override
    public void onEncodeRejected(EncodeRejectedEvent event) {
        log.debug("DAG-CBOR encode rejected ({}) at {}: {}",
            event.kind(),
            event.path(),
            event.message());
    }

    @Override
    public void onClockAdjusted(TidClockEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("TID clock {} moved forward {}us (observed={}, issued={})",
                event.clockId(),
                event.skewMicros(),
                event.observedMicros(),
                event.issuedMicros());
        }
    }
}
