package com.questrail.qrcode.observability;

import com.questrail.qrcode.api.RecoveryLevel;

/**
 * Record describing the QR Code version chosen for a piece of content.
 *
 * @param encodedBits  length of the encoded segments, before terminator and padding
 * @param capacityBits data capacity of the chosen version
 */
public record VersionSelectedEvent(
    int version,
    RecoveryLevel level,
    int encodedBits,
    int capacityBits
) {
}
