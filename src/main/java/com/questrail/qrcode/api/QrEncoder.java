package com.questrail.qrcode.api;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * QrEncoder
 * -----------------------------------------------------------------------------
 * Encodes content into a finished QR Code (Model 2) module matrix.
 *
 * <p>The returned {@link QrMatrix} is all a renderer needs; rasterizing it
 * (PNG, SVG, terminal output) is outside this library.</p>
 *
 * <h2>Error Model</h2>
 * <ul>
 *   <li>{@link ContentTooLongException}: the content exceeds the capacity
 *       of version 40 at the requested level. No partial result exists.</li>
 *   <li>{@link IllegalArgumentException}: empty content.</li>
 * </ul>
 *
 * Implementations must be deterministic and safe for concurrent use.
 */
public interface QrEncoder
{
    /**
     * Encodes raw content bytes.
     *
     * @param content content bytes, not empty
     * @param level   requested error recovery level
     * @return the module matrix of the smallest fitting version
     * @throws ContentTooLongException if no version can hold the content
     */
    QrMatrix encode(byte[] content, RecoveryLevel level) throws ContentTooLongException;

    /**
     * Encodes text as UTF-8.
     *
     * @see #encode(byte[], RecoveryLevel)
     */
    default QrMatrix encode(String content, RecoveryLevel level) throws ContentTooLongException {
        Objects.requireNonNull(content, "content");
        return encode(content.getBytes(StandardCharsets.UTF_8), level);
    }
}
