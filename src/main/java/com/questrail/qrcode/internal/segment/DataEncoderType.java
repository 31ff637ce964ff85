package com.questrail.qrcode.internal.segment;

/**
 * DataEncoderType
 * -----------------------------------------------------------------------------
 * The three QR Code version brackets that share character count field widths
 * (ISO/IEC 18004 Table 3).
 *
 * <pre>
 *   bracket      numeric  alphanumeric  byte
 *   1  - 9         10          9          8
 *   10 - 26        12         11         16
 *   27 - 40        14         13         16
 * </pre>
 *
 * <p>Declared from the smallest to the largest bracket; the encoder façade
 * tries them in this order.</p>
 */
public enum DataEncoderType
{
    VERSIONS_1_TO_9(1, 9, 10, 9, 8),
    VERSIONS_10_TO_26(10, 26, 12, 11, 16),
    VERSIONS_27_TO_40(27, 40, 14, 13, 16);

    private final int minVersion;
    private final int maxVersion;
    private final int numericCountBits;
    private final int alphanumericCountBits;
    private final int byteCountBits;

    DataEncoderType(int minVersion,
                    int maxVersion,
                    int numericCountBits,
                    int alphanumericCountBits,
                    int byteCountBits)
    {
        this.minVersion = minVersion;
        this.maxVersion = maxVersion;
        this.numericCountBits = numericCountBits;
        this.alphanumericCountBits = alphanumericCountBits;
        this.byteCountBits = byteCountBits;
    }

    public int minVersion()
    {
        return minVersion;
    }

    public int maxVersion()
    {
        return maxVersion;
    }

    /**
     * Returns true if {@code version} lies within this bracket.
     */
    public boolean supports(int version)
    {
        return version >= minVersion && version <= maxVersion;
    }

    /**
     * Returns the width of the character count field for {@code mode}.
     */
    public int charCountBits(DataMode mode)
    {
        return switch (mode) {
            case NUMERIC -> numericCountBits;
            case ALPHANUMERIC -> alphanumericCountBits;
            case BYTE -> byteCountBits;
        };
    }

    /**
     * Returns the number of bits a segment of {@code numChars} characters in
     * {@code mode} occupies, including mode indicator and count field.
     *
     * @throws SegmentLengthException if {@code numChars} does not fit the count field
     */
    int encodedLength(DataMode mode, int numChars)
            throws SegmentLengthException
    {
        final int countBits = charCountBits(mode);
        final int maxChars = (1 << countBits) - 1;
        if (numChars > maxChars) {
            throw new SegmentLengthException(String.format(
                    "%d %s characters exceed the %d-bit count field of %s",
                    numChars, mode, countBits, this));
        }

        int length = DataMode.INDICATOR_BITS + countBits;
        switch (mode) {
            case NUMERIC -> {
                length += 10 * (numChars / 3);
                if (numChars % 3 != 0) {
                    length += 1 + 3 * (numChars % 3);
                }
            }
            case ALPHANUMERIC -> {
                length += 11 * (numChars / 2);
                length += 6 * (numChars % 2);
            }
            case BYTE -> length += 8 * numChars;
        }
        return length;
    }
}
