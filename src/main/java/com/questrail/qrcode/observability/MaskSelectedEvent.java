package com.questrail.qrcode.observability;

import com.questrail.qrcode.api.RecoveryLevel;

/**
 * Record describing the mask kept for the final symbol.
 */
public record MaskSelectedEvent(
    int version,
    RecoveryLevel level,
    int maskPattern,
    int penalty
) {
}
