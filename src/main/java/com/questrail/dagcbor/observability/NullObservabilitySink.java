package com.questrail.dagcbor.observability;

/**
 * No-op implementation of CodecObservabilitySink.
 */
public final class NullObservabilitySink implements CodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDecodeRejected(DecodeRejectedEvent event) {}

    @Override
    public void onEncodeRejected(EncodeRejectedEvent event) {}

    @Override
    public void onClockAdjusted(TidClockEvent event) {}
}
