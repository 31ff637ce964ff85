package com.questrail.qrcode.api;

/**
 * Error recovery level of a QR Code symbol.
 *
 * <p>Higher levels recover from more damage at the cost of a larger symbol
 * for the same content. Declared in ascending order of protection.</p>
 */
public enum RecoveryLevel
{
    /** Level L: about 7% of codewords can be restored. */
    LOW(0b01, 7),

    /** Level M: about 15% of codewords can be restored. A good default. */
    MEDIUM(0b00, 15),

    /** Level Q: about 25% of codewords can be restored. */
    HIGH(0b11, 25),

    /** Level H: about 30% of codewords can be restored. */
    HIGHEST(0b10, 30);

    private final int formatBits;
    private final int recoveryPercent;

    RecoveryLevel(int formatBits, int recoveryPercent) {
        this.formatBits = formatBits;
        this.recoveryPercent = recoveryPercent;
    }

    /**
     * Returns the 2-bit level indicator used in the Format Information.
     */
    public int formatBits() {
        return formatBits;
    }

    /**
     * Returns the approximate share of recoverable codewords, in percent.
     */
    public int recoveryPercent() {
        return recoveryPercent;
    }
}
