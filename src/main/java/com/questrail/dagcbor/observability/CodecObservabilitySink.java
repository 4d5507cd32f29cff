package com.questrail.dagcbor.observability;

/**
 * Receives observability events from the codec and the TID clock.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked synchronously on the calling thread and must not
 * throw.</p>
 */
public interface CodecObservabilitySink {
    /**
     * Called when the decoder rejects its input, before the exception propagates.
     * @param event the rejection details
     */
    void onDecodeRejected(DecodeRejectedEvent event);

    /**
     * Called when the encoder rejects a value, before the exception propagates.
     * @param event the rejection details
     */
    void onEncodeRejected(EncodeRejectedEvent event);

    /**
     * Called when a TID clock issues a later timestamp than its time source reported.
     * @param event the adjustment details
     */
    void onClockAdjusted(TidClockEvent event);
}
