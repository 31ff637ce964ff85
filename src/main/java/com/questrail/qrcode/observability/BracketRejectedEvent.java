package com.questrail.qrcode.observability;

import com.questrail.qrcode.api.RecoveryLevel;

/**
 * Record describing a version bracket that could not hold the content.
 */
public record BracketRejectedEvent(
    int minVersion,
    int maxVersion,
    RecoveryLevel level,
    int contentLength,
    Reason reason
) {
    public enum Reason {
        /** A segment has more characters than the count field can express. */
        COUNT_FIELD_OVERFLOW,

        /** The encoded data exceeds the largest version of the bracket. */
        CAPACITY_EXCEEDED
    }
}
