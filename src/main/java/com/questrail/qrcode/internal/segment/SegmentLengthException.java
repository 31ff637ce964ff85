package com.questrail.qrcode.internal.segment;

/**
 * Thrown when a segment holds more characters than the character count field
 * of the current encoder bracket can express.
 *
 * <p>Never escapes this package: {@link DataEncoder#encode(byte[])} reports
 * the bracket as unusable instead.</p>
 */
final class SegmentLengthException extends Exception
{
    SegmentLengthException(String message) {
        super(message);
    }
}
