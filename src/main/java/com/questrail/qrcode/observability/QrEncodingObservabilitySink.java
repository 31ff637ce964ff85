package com.questrail.qrcode.observability;

/**
 * Main interface for receiving QR Code encoding observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run synchronously on the encoding thread.</p>
 */
public interface QrEncodingObservabilitySink {
    /**
     * Called when a version bracket cannot hold the content and the next,
     * wider bracket is tried.
     * @param event the rejected bracket
     */
    void onBracketRejected(BracketRejectedEvent event);

    /**
     * Called once the smallest fitting version has been chosen.
     * @param event the chosen version and its capacity
     */
    void onVersionSelected(VersionSelectedEvent event);

    /**
     * Called after each of the eight candidate masks has been scored.
     * @param event the mask and its penalty
     */
    void onMaskEvaluated(MaskEvaluatedEvent event);

    /**
     * Called when the lowest-penalty mask has been kept.
     * @param event the winning mask
     */
    void onMaskSelected(MaskSelectedEvent event);

    /**
     * Called when content cannot be encoded at all.
     * @param event the failure
     */
    void onError(EncodingFailedEvent event);
}
