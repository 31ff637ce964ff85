package com.questrail.qrcode.internal.segment;

/**
 * QR Code data encoding modes supported by the encoder, declared from the
 * most restrictive to the most general.
 *
 * <p>Every byte that can be encoded in a mode can also be encoded in any mode
 * declared after it, so {@link #compareTo} orders modes by generality.</p>
 */
public enum DataMode
{
    /** Digits {@code 0-9}. */
    NUMERIC(0b0001),

    /** Digits, upper-case {@code A-Z} and {@code " $%*+-./:"}. */
    ALPHANUMERIC(0b0010),

    /** Arbitrary 8-bit data. */
    BYTE(0b0100);

    /** Width of every mode indicator. */
    public static final int INDICATOR_BITS = 4;

    private static final String ALPHANUMERIC_CHARSET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ $%*+-./:";

    private final int indicator;

    DataMode(int indicator) {
        this.indicator = indicator;
    }

    /**
     * Returns the 4-bit mode indicator written before each segment.
     */
    public int indicator() {
        return indicator;
    }

    /**
     * Returns the most restrictive mode able to encode {@code value}.
     */
    public static DataMode classify(byte value) {
        int v = value & 0xFF;
        if (v >= '0' && v <= '9') {
            return NUMERIC;
        }
        if (alphanumericValue(v) >= 0) {
            return ALPHANUMERIC;
        }
        return BYTE;
    }

    /**
     * Returns the value of {@code c} in the 45-symbol alphanumeric alphabet,
     * or {@code -1} if it is not part of it.
     */
    static int alphanumericValue(int c) {
        if (c < 0 || c > 0x7F) {
            return -1;
        }
        return ALPHANUMERIC_CHARSET.indexOf(c);
    }
}
