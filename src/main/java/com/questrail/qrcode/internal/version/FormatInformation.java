package com.questrail.qrcode.internal.version;

import com.questrail.qrcode.api.RecoveryLevel;

import java.util.Objects;

/**
 * FormatInformation
 * -----------------------------------------------------------------------------
 * BCH-protected meta fields of a QR Code symbol (ISO/IEC 18004 Sections 7.9
 * and 7.10).
 *
 * <h2>Format Information (15 bits)</h2>
 * <p>5 data bits followed by 10 BCH(15,5) error correction bits, XOR-ed with
 * {@code 101010000010010}. The data bits are the 2-bit level indicator
 * (L=01, M=00, Q=11, H=10) and the 3-bit mask pattern id.</p>
 * <pre>
 *   level L, mask 001:  01 | 001 = 01001 = 0x9  →  0x72f3
 * </pre>
 *
 * <h2>Version Information (18 bits)</h2>
 * <p>6-bit version number followed by 12 BCH(18,6) bits. Only versions 7-40
 * carry it.</p>
 *
 * <p>Both fields are precomputed; the tables are never written after class
 * initialization.</p>
 */
public final class FormatInformation
{
    public static final int FORMAT_INFO_LENGTH_BITS = 15;
    public static final int VERSION_INFO_LENGTH_BITS = 18;

    static final int MIN_VERSION_WITH_VERSION_INFO = 7;

    /* Indexed by (level bits << 3) | mask pattern */
    private static final int[] FORMAT_BIT_SEQUENCE = {
            0x5412, 0x5125, 0x5e7c, 0x5b4b, 0x45f9, 0x40ce, 0x4f97, 0x4aa0,
            0x77c4, 0x72f3, 0x7daa, 0x789d, 0x662f, 0x6318, 0x6c41, 0x6976,
            0x1689, 0x13be, 0x1ce7, 0x19d0, 0x0762, 0x0255, 0x0d0c, 0x083b,
            0x355f, 0x3068, 0x3f31, 0x3a06, 0x24b4, 0x2183, 0x2eda, 0x2bed
    };

    /* Indexed by version number; entries below version 7 are unused */
    private static final int[] VERSION_BIT_SEQUENCE = {
            0x00000, 0x00000, 0x00000, 0x00000, 0x00000, 0x00000,
            0x00000, 0x07c94, 0x085bc, 0x09a99, 0x0a4d3, 0x0bbf6,
            0x0c762, 0x0d847, 0x0e60d, 0x0f928, 0x10b78, 0x1145d,
            0x12a17, 0x13532, 0x149a6, 0x15683, 0x168c9, 0x177ec,
            0x18ec4, 0x191e1, 0x1afab, 0x1b08e, 0x1cc1a, 0x1d33f,
            0x1ed75, 0x1f250, 0x209d5, 0x216f0, 0x228ba, 0x2379f,
            0x24b0b, 0x2542e, 0x26a64, 0x27541, 0x28c69
    };

    private FormatInformation() {}

    /**
     * Returns the 15-bit Format Information value.
     *
     * @throws IllegalArgumentException if {@code maskPattern} is outside 0-7
     */
    public static int formatInfo(RecoveryLevel level, int maskPattern)
    {
        Objects.requireNonNull(level, "level");
        if (maskPattern < 0 || maskPattern > 7) {
            throw new IllegalArgumentException("Invalid mask pattern " + maskPattern);
        }
        return FORMAT_BIT_SEQUENCE[(level.formatBits() << 3) | maskPattern];
    }

    /**
     * Returns the 18-bit Version Information value.
     *
     * @throws IllegalStateException if {@code version} carries no Version Information
     */
    public static int versionInfo(int version)
    {
        if (version < MIN_VERSION_WITH_VERSION_INFO || version > 40) {
            throw new IllegalStateException("Version " + version + " has no Version Information");
        }
        return VERSION_BIT_SEQUENCE[version];
    }
}
