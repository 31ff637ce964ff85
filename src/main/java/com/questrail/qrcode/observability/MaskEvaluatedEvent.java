package com.questrail.qrcode.observability;

/**
 * Record carrying the penalty score of one candidate mask.
 */
public record MaskEvaluatedEvent(
    int version,
    int maskPattern,
    int penalty
) {
}
