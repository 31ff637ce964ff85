package com.questrail.qrcode.internal.version;

import com.questrail.qrcode.api.RecoveryLevel;

import java.util.List;
import java.util.Objects;

/**
 * QrVersion
 * -----------------------------------------------------------------------------
 * Capacity record of one (version, recovery level) combination.
 *
 * <p>There are 40 versions x 4 levels = 160 records, all held by
 * {@link QrVersionTable}. The data codewords are split into one or two
 * {@link BlockGroup}s, each block carrying its own error correction
 * codewords.</p>
 *
 * @param version       version number, 1-40
 * @param level         error recovery level
 * @param blockGroups   block layout, in placement order
 * @param remainderBits zero bits appended after the interleaved codewords
 */
public record QrVersion(int version, RecoveryLevel level, List<BlockGroup> blockGroups, int remainderBits)
{
    /** Width of the quiet zone on each side, in modules. */
    public static final int QUIET_ZONE_SIZE = 4;

    /** Maximum number of terminator bits. */
    static final int TERMINATOR_BITS = 4;

    public QrVersion {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(blockGroups, "blockGroups");
        if (version < 1 || version > 40) {
            throw new IllegalArgumentException("version must be in [1, 40]: " + version);
        }
        if (blockGroups.isEmpty()) {
            throw new IllegalArgumentException("At least one block group is required");
        }
        blockGroups = List.copyOf(blockGroups);
    }

    /**
     * Returns the data capacity in bits.
     */
    public int numDataBits() {
        int numDataBits = 0;
        for (BlockGroup g : blockGroups) {
            numDataBits += 8 * g.numBlocks() * g.numDataCodewords();
        }
        return numDataBits;
    }

    /**
     * Returns the total number of blocks over all groups.
     */
    public int numBlocks() {
        int numBlocks = 0;
        for (BlockGroup g : blockGroups) {
            numBlocks += g.numBlocks();
        }
        return numBlocks;
    }

    /**
     * Returns the number of terminator bits to append after
     * {@code numDataBits} bits of encoded data: four, or fewer if the
     * capacity runs out first.
     */
    public int numTerminatorBitsRequired(int numDataBits) {
        return Math.min(TERMINATOR_BITS, numDataBits() - numDataBits);
    }

    /**
     * Returns the number of zero bits that bring {@code numDataBits} up to the
     * next codeword boundary. Zero if the capacity is already reached.
     */
    public int numBitsToPadToCodeword(int numDataBits) {
        if (numDataBits == numDataBits()) {
            return 0;
        }
        return (8 - numDataBits % 8) % 8;
    }

    /**
     * Returns the width of the symbol in modules, excluding the quiet zone.
     */
    public int symbolSize() {
        return 21 + 4 * (version - 1);
    }

    /**
     * Returns the 15-bit Format Information for this level and {@code maskPattern}.
     */
    public int formatInfo(int maskPattern) {
        return FormatInformation.formatInfo(level, maskPattern);
    }

    /**
     * Returns true if the symbol carries an 18-bit Version Information field.
     */
    public boolean hasVersionInfo() {
        return version >= FormatInformation.MIN_VERSION_WITH_VERSION_INFO;
    }

    /**
     * Returns the 18-bit Version Information.
     *
     * @throws IllegalStateException for versions below 7, which carry none
     */
    public int versionInfo() {
        return FormatInformation.versionInfo(version);
    }

    @Override
    public String toString() {
        return version + "-" + level;
    }
}
