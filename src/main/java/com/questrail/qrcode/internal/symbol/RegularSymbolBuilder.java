package com.questrail.qrcode.internal.symbol;

import com.questrail.qrcode.internal.bits.BitVector;
import com.questrail.qrcode.internal.version.FormatInformation;
import com.questrail.qrcode.internal.version.QrVersion;

import java.util.Objects;

/**
 * RegularSymbolBuilder
 * -----------------------------------------------------------------------------
 * Lays out a QR Code Model 2 symbol for one version and one mask pattern.
 *
 * <p>Placement order (ISO/IEC 18004 Sections 6.3 and 7.7):</p>
 * <ol>
 *   <li>Finder patterns with their separators</li>
 *   <li>Alignment patterns (skipping centres that overlap finder patterns)</li>
 *   <li>Timing patterns</li>
 *   <li>Format Information and the dark module</li>
 *   <li>Version Information (versions 7-40)</li>
 *   <li>Masked data and error correction codewords, in the two-column
 *       zig-zag starting at the bottom right corner</li>
 * </ol>
 *
 * <p>The builder does not choose the mask; see {@link PenaltyScorer}.</p>
 */
public final class RegularSymbolBuilder
{
    private static final boolean B0 = false;
    private static final boolean B1 = true;

    private static final int FINDER_PATTERN_SIZE = 7;

    /* Vertical timing pattern column; the data zig-zag skips it */
    private static final int TIMING_COLUMN = 6;

    private static final boolean[][] FINDER_PATTERN = {
            {B1, B1, B1, B1, B1, B1, B1},
            {B1, B0, B0, B0, B0, B0, B1},
            {B1, B0, B1, B1, B1, B0, B1},
            {B1, B0, B1, B1, B1, B0, B1},
            {B1, B0, B1, B1, B1, B0, B1},
            {B1, B0, B0, B0, B0, B0, B1},
            {B1, B1, B1, B1, B1, B1, B1},
    };

    private static final boolean[][] FINDER_HORIZONTAL_SEPARATOR = {
            {B0, B0, B0, B0, B0, B0, B0, B0},
    };

    private static final boolean[][] FINDER_VERTICAL_SEPARATOR = {
            {B0}, {B0}, {B0}, {B0}, {B0}, {B0}, {B0}, {B0},
    };

    private static final boolean[][] ALIGNMENT_PATTERN = {
            {B1, B1, B1, B1, B1},
            {B1, B0, B0, B0, B1},
            {B1, B0, B1, B0, B1},
            {B1, B0, B0, B0, B1},
            {B1, B1, B1, B1, B1},
    };

    /* Alignment pattern centre coordinates by version (ISO/IEC 18004 Annex E) */
    private static final int[][] ALIGNMENT_PATTERN_CENTER = {
            /*  0 */ {},
            /*  1 */ {},
            /*  2 */ {6, 18},
            /*  3 */ {6, 22},
            /*  4 */ {6, 26},
            /*  5 */ {6, 30},
            /*  6 */ {6, 34},
            /*  7 */ {6, 22, 38},
            /*  8 */ {6, 24, 42},
            /*  9 */ {6, 26, 46},
            /* 10 */ {6, 28, 50},
            /* 11 */ {6, 30, 54},
            /* 12 */ {6, 32, 58},
            /* 13 */ {6, 34, 62},
            /* 14 */ {6, 26, 46, 66},
            /* 15 */ {6, 26, 48, 70},
            /* 16 */ {6, 26, 50, 74},
            /* 17 */ {6, 30, 54, 78},
            /* 18 */ {6, 30, 56, 82},
            /* 19 */ {6, 30, 58, 86},
            /* 20 */ {6, 34, 62, 90},
            /* 21 */ {6, 28, 50, 72, 94},
            /* 22 */ {6, 26, 50, 74, 98},
            /* 23 */ {6, 30, 54, 78, 102},
            /* 24 */ {6, 28, 54, 80, 106},
            /* 25 */ {6, 32, 58, 84, 110},
            /* 26 */ {6, 30, 58, 86, 114},
            /* 27 */ {6, 34, 62, 90, 118},
            /* 28 */ {6, 26, 50, 74, 98, 122},
            /* 29 */ {6, 30, 54, 78, 102, 126},
            /* 30 */ {6, 26, 52, 78, 104, 130},
            /* 31 */ {6, 30, 56, 82, 108, 134},
            /* 32 */ {6, 34, 60, 86, 112, 138},
            /* 33 */ {6, 30, 58, 86, 114, 142},
            /* 34 */ {6, 34, 62, 90, 118, 146},
            /* 35 */ {6, 30, 54, 78, 102, 126, 150},
            /* 36 */ {6, 24, 50, 76, 102, 128, 154},
            /* 37 */ {6, 28, 54, 80, 106, 132, 158},
            /* 38 */ {6, 32, 58, 84, 110, 136, 162},
            /* 39 */ {6, 26, 54, 82, 110, 138, 166},
            /* 40 */ {6, 30, 58, 86, 114, 142, 170},
    };

    private final QrVersion version;
    private final MaskPattern mask;
    private final BitVector data;
    private final Symbol symbol;
    private final int size;

    private RegularSymbolBuilder(QrVersion version, MaskPattern mask, BitVector data, int quietZoneSize)
    {
        this.version = version;
        this.mask = mask;
        this.data = data;
        this.size = version.symbolSize();
        this.symbol = new Symbol(size, quietZoneSize);
    }

    /**
     * Builds the symbol for {@code version} with {@code mask} applied.
     *
     * @param data             interleaved codewords plus remainder bits
     * @param includeQuietZone whether to surround the symbol with a quiet zone
     */
    public static Symbol build(QrVersion version, MaskPattern mask, BitVector data, boolean includeQuietZone)
    {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(mask, "mask");
        Objects.requireNonNull(data, "data");

        RegularSymbolBuilder b = new RegularSymbolBuilder(
                version, mask, data, includeQuietZone ? QrVersion.QUIET_ZONE_SIZE : 0);

        b.addFinderPatterns();
        b.addAlignmentPatterns();
        b.addTimingPatterns();
        b.addFormatInfo();
        b.addVersionInfo();
        b.addData();
        return b.symbol;
    }

    private void addFinderPatterns()
    {
        final int fp = FINDER_PATTERN_SIZE;

        // Top left
        symbol.setPattern(0, 0, FINDER_PATTERN);
        symbol.setPattern(0, fp, FINDER_HORIZONTAL_SEPARATOR);
        symbol.setPattern(fp, 0, FINDER_VERTICAL_SEPARATOR);

        // Top right
        symbol.setPattern(size - fp, 0, FINDER_PATTERN);
        symbol.setPattern(size - fp - 1, fp, FINDER_HORIZONTAL_SEPARATOR);
        symbol.setPattern(size - fp - 1, 0, FINDER_VERTICAL_SEPARATOR);

        // Bottom left
        symbol.setPattern(0, size - fp, FINDER_PATTERN);
        symbol.setPattern(0, size - fp - 1, FINDER_HORIZONTAL_SEPARATOR);
        symbol.setPattern(fp, size - fp - 1, FINDER_VERTICAL_SEPARATOR);
    }

    private void addAlignmentPatterns()
    {
        final int[] centers = ALIGNMENT_PATTERN_CENTER[version.version()];
        for (int x : centers) {
            for (int y : centers) {
                if (!symbol.isEmpty(x, y)) {
                    continue;
                }
                symbol.setPattern(x - 2, y - 2, ALIGNMENT_PATTERN);
            }
        }
    }

    private void addTimingPatterns()
    {
        boolean value = true;
        for (int i = FINDER_PATTERN_SIZE + 1; i < size - FINDER_PATTERN_SIZE; i++) {
            symbol.set(i, TIMING_COLUMN, value);
            symbol.set(TIMING_COLUMN, i, value);
            value = !value;
        }
    }

    private void addFormatInfo()
    {
        final int fp = FINDER_PATTERN_SIZE;
        final int f = version.formatInfo(mask.id());

        // Bits 0-7 under the top right finder pattern
        for (int i = 0; i <= 7; i++) {
            symbol.set(size - i - 1, fp + 1, bit(f, i));
        }

        // Bits 0-5 right of the top left finder pattern
        for (int i = 0; i <= 5; i++) {
            symbol.set(fp + 1, i, bit(f, i));
        }

        // Bits 6-8 around the corner of the top left finder pattern
        symbol.set(fp + 1, fp, bit(f, 6));
        symbol.set(fp + 1, fp + 1, bit(f, 7));
        symbol.set(fp, fp + 1, bit(f, 8));

        // Bits 9-14 under the top left finder pattern
        for (int i = 9; i < FormatInformation.FORMAT_INFO_LENGTH_BITS; i++) {
            symbol.set(14 - i, fp + 1, bit(f, i));
        }

        // Bits 8-14 right of the bottom left finder pattern
        for (int i = 8; i < FormatInformation.FORMAT_INFO_LENGTH_BITS; i++) {
            symbol.set(fp + 1, size - fp + i - 8, bit(f, i));
        }

        // Dark module
        symbol.set(fp + 1, size - fp - 1, true);
    }

    private void addVersionInfo()
    {
        if (!version.hasVersionInfo()) {
            return;
        }

        final int fp = FINDER_PATTERN_SIZE;
        final int v = version.versionInfo();

        for (int i = 0; i < FormatInformation.VERSION_INFO_LENGTH_BITS; i++) {
            // Above the bottom left finder pattern
            symbol.set(i / 3, size - fp - 4 + i % 3, bit(v, i));

            // Left of the top right finder pattern
            symbol.set(size - fp - 4 + i % 3, i / 3, bit(v, i));
        }
    }

    private void addData()
    {
        // The cursor covers the column pair (x, x + 1); xOffset selects the column.
        int xOffset = 1;
        boolean upwards = true;

        int x = size - 2;
        int y = size - 1;

        for (int i = 0; i < data.length(); i++) {
            final int column = x + xOffset;
            symbol.set(column, y, mask.isMasked(y, column) != data.get(i));

            if (i == data.length() - 1) {
                break;
            }

            // Advance to the next free module
            do {
                if (xOffset == 1) {
                    xOffset = 0;
                } else {
                    xOffset = 1;
                    if (upwards) {
                        if (y > 0) {
                            y--;
                        } else {
                            upwards = false;
                            x -= 2;
                        }
                    } else {
                        if (y < size - 1) {
                            y++;
                        } else {
                            upwards = true;
                            x -= 2;
                        }
                    }
                }

                if (x == TIMING_COLUMN - 1) {
                    x--;
                }
            } while (!symbol.isEmpty(x + xOffset, y));
        }
    }

    /* Bit i of value, counted from the least significant bit */
    private static boolean bit(int value, int i)
    {
        return ((value >>> i) & 1) != 0;
    }
}
