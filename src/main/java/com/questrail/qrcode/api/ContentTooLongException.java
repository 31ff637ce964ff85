package com.questrail.qrcode.api;

import java.util.Objects;

/**
 * Indicates that content does not fit any supported QR Code version at the
 * requested {@link RecoveryLevel}.
 *
 * <p>Encoding is deterministic: retrying with the same content and level
 * fails the same way. Callers may retry with a lower level or less content.</p>
 */
public final class ContentTooLongException extends Exception
{
    private final int contentLength;
    private final RecoveryLevel level;

    public ContentTooLongException(int contentLength, RecoveryLevel level) {
        super(String.format(
                "Content of %d bytes does not fit any supported version at recovery level %s",
                contentLength, level));
        this.contentLength = contentLength;
        this.level = Objects.requireNonNull(level, "level");
    }

    /**
     * Returns the length, in bytes, of the rejected content.
     */
    public int contentLength() {
        return contentLength;
    }

    public RecoveryLevel level() {
        return level;
    }
}
