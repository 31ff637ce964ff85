package com.questrail.qrcode.observability;

/**
 * No-op implementation of QrEncodingObservabilitySink.
 */
public final class NullObservabilitySink implements QrEncodingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onBracketRejected(BracketRejectedEvent event) {}

    @Override
    public void onVersionSelected(VersionSelectedEvent event) {}

    @Override
    public void onMaskEvaluated(MaskEvaluatedEvent event) {}

    @Override
    public void onMaskSelected(MaskSelectedEvent event) {}

    @Override
    public void onError(EncodingFailedEvent event) {}
}
