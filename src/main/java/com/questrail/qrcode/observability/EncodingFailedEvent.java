package com.questrail.qrcode.observability;

import java.time.Instant;

/**
 * Record representing content that could not be encoded.
 *
 * @param timestamp when the failure was reported, not part of the encoding
 * @param message   human-readable failure description
 * @param cause     the exception thrown to the caller
 */
public record EncodingFailedEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
