package com.questrail.qrcode.internal.version;

import com.questrail.qrcode.api.RecoveryLevel;
import com.questrail.qrcode.internal.segment.DataEncoderType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.qrcode.api.RecoveryLevel.HIGH;
import static com.questrail.qrcode.api.RecoveryLevel.HIGHEST;
import static com.questrail.qrcode.api.RecoveryLevel.LOW;
import static com.questrail.qrcode.api.RecoveryLevel.MEDIUM;

/**
 * QrVersionTable
 * -----------------------------------------------------------------------------
 * The 160 QR Code capacity records (ISO/IEC 18004 Table 9), ordered by version
 * and then by recovery level.
 *
 * <p>Each row lists the remainder bit count followed by the block groups as
 * {@code (blocks, codewords per block, data codewords per block)}.</p>
 */
public final class QrVersionTable
{
    private static final List<QrVersion> VERSIONS = List.of(
            version(1, LOW, 0, group(1, 26, 19)),
            version(1, MEDIUM, 0, group(1, 26, 16)),
            version(1, HIGH, 0, group(1, 26, 13)),
            version(1, HIGHEST, 0, group(1, 26, 9)),
            version(2, LOW, 7, group(1, 44, 34)),
            version(2, MEDIUM, 7, group(1, 44, 28)),
            version(2, HIGH, 7, group(1, 44, 22)),
            version(2, HIGHEST, 7, group(1, 44, 16)),
            version(3, LOW, 7, group(1, 70, 55)),
            version(3, MEDIUM, 7, group(1, 70, 44)),
            version(3, HIGH, 7, group(2, 35, 17)),
            version(3, HIGHEST, 7, group(2, 35, 13)),
            version(4, LOW, 7, group(1, 100, 80)),
            version(4, MEDIUM, 7, group(2, 50, 32)),
            version(4, HIGH, 7, group(2, 50, 24)),
            version(4, HIGHEST, 7, group(4, 25, 9)),
            version(5, LOW, 7, group(1, 134, 108)),
            version(5, MEDIUM, 7, group(2, 67, 43)),
            version(5, HIGH, 7, group(2, 33, 15), group(2, 34, 16)),
            version(5, HIGHEST, 7, group(2, 33, 11), group(2, 34, 12)),
            version(6, LOW, 7, group(2, 86, 68)),
            version(6, MEDIUM, 7, group(4, 43, 27)),
            version(6, HIGH, 7, group(4, 43, 19)),
            version(6, HIGHEST, 7, group(4, 43, 15)),
            version(7, LOW, 0, group(2, 98, 78)),
            version(7, MEDIUM, 0, group(4, 49, 31)),
            version(7, HIGH, 0, group(2, 32, 14), group(4, 33, 15)),
            version(7, HIGHEST, 0, group(4, 39, 13), group(1, 40, 14)),
            version(8, LOW, 0, group(2, 121, 97)),
            version(8, MEDIUM, 0, group(2, 60, 38), group(2, 61, 39)),
            version(8, HIGH, 0, group(4, 40, 18), group(2, 41, 19)),
            version(8, HIGHEST, 0, group(4, 40, 14), group(2, 41, 15)),
            version(9, LOW, 0, group(2, 146, 116)),
            version(9, MEDIUM, 0, group(3, 58, 36), group(2, 59, 37)),
            version(9, HIGH, 0, group(4, 36, 16), group(4, 37, 17)),
            version(9, HIGHEST, 0, group(4, 36, 12), group(4, 37, 13)),
            version(10, LOW, 0, group(2, 86, 68), group(2, 87, 69)),
            version(10, MEDIUM, 0, group(4, 69, 43), group(1, 70, 44)),
            version(10, HIGH, 0, group(6, 43, 19), group(2, 44, 20)),
            version(10, HIGHEST, 0, group(6, 43, 15), group(2, 44, 16)),
            version(11, LOW, 0, group(4, 101, 81)),
            version(11, MEDIUM, 0, group(1, 80, 50), group(4, 81, 51)),
            version(11, HIGH, 0, group(4, 50, 22), group(4, 51, 23)),
            version(11, HIGHEST, 0, group(3, 36, 12), group(8, 37, 13)),
            version(12, LOW, 0, group(2, 116, 92), group(2, 117, 93)),
            version(12, MEDIUM, 0, group(6, 58, 36), group(2, 59, 37)),
            version(12, HIGH, 0, group(4, 46, 20), group(6, 47, 21)),
            version(12, HIGHEST, 0, group(7, 42, 14), group(4, 43, 15)),
            version(13, LOW, 0, group(4, 133, 107)),
            version(13, MEDIUM, 0, group(8, 59, 37), group(1, 60, 38)),
            version(13, HIGH, 0, group(8, 44, 20), group(4, 45, 21)),
            version(13, HIGHEST, 0, group(12, 33, 11), group(4, 34, 12)),
            version(14, LOW, 3, group(3, 145, 115), group(1, 146, 116)),
            version(14, MEDIUM, 3, group(4, 64, 40), group(5, 65, 41)),
            version(14, HIGH, 3, group(11, 36, 16), group(5, 37, 17)),
            version(14, HIGHEST, 3, group(11, 36, 12), group(5, 37, 13)),
            version(15, LOW, 3, group(5, 109, 87), group(1, 110, 88)),
            version(15, MEDIUM, 3, group(5, 65, 41), group(5, 66, 42)),
            version(15, HIGH, 3, group(5, 54, 24), group(7, 55, 25)),
            version(15, HIGHEST, 3, group(11, 36, 12), group(7, 37, 13)),
            version(16, LOW, 3, group(5, 122, 98), group(1, 123, 99)),
            version(16, MEDIUM, 3, group(7, 73, 45), group(3, 74, 46)),
            version(16, HIGH, 3, group(15, 43, 19), group(2, 44, 20)),
            version(16, HIGHEST, 3, group(3, 45, 15), group(13, 46, 16)),
            version(17, LOW, 3, group(1, 135, 107), group(5, 136, 108)),
            version(17, MEDIUM, 3, group(10, 74, 46), group(1, 75, 47)),
            version(17, HIGH, 3, group(1, 50, 22), group(15, 51, 23)),
            version(17, HIGHEST, 3, group(2, 42, 14), group(17, 43, 15)),
            version(18, LOW, 3, group(5, 150, 120), group(1, 151, 121)),
            version(18, MEDIUM, 3, group(9, 69, 43), group(4, 70, 44)),
            version(18, HIGH, 3, group(17, 50, 22), group(1, 51, 23)),
            version(18, HIGHEST, 3, group(2, 42, 14), group(19, 43, 15)),
            version(19, LOW, 3, group(3, 141, 113), group(4, 142, 114)),
            version(19, MEDIUM, 3, group(3, 70, 44), group(11, 71, 45)),
            version(19, HIGH, 3, group(17, 47, 21), group(4, 48, 22)),
            version(19, HIGHEST, 3, group(9, 39, 13), group(16, 40, 14)),
            version(20, LOW, 3, group(3, 135, 107), group(5, 136, 108)),
            version(20, MEDIUM, 3, group(3, 67, 41), group(13, 68, 42)),
            version(20, HIGH, 3, group(15, 54, 24), group(5, 55, 25)),
            version(20, HIGHEST, 3, group(15, 43, 15), group(10, 44, 16)),
            version(21, LOW, 4, group(4, 144, 116), group(4, 145, 117)),
            version(21, MEDIUM, 4, group(17, 68, 42)),
            version(21, HIGH, 4, group(17, 50, 22), group(6, 51, 23)),
            version(21, HIGHEST, 4, group(19, 46, 16), group(6, 47, 17)),
            version(22, LOW, 4, group(2, 139, 111), group(7, 140, 112)),
            version(22, MEDIUM, 4, group(17, 74, 46)),
            version(22, HIGH, 4, group(7, 54, 24), group(16, 55, 25)),
            version(22, HIGHEST, 4, group(34, 37, 13)),
            version(23, LOW, 4, group(4, 151, 121), group(5, 152, 122)),
            version(23, MEDIUM, 4, group(4, 75, 47), group(14, 76, 48)),
            version(23, HIGH, 4, group(11, 54, 24), group(14, 55, 25)),
            version(23, HIGHEST, 4, group(16, 45, 15), group(14, 46, 16)),
            version(24, LOW, 4, group(6, 147, 117), group(4, 148, 118)),
            version(24, MEDIUM, 4, group(6, 73, 45), group(14, 74, 46)),
            version(24, HIGH, 4, group(11, 54, 24), group(16, 55, 25)),
            version(24, HIGHEST, 4, group(30, 46, 16), group(2, 47, 17)),
            version(25, LOW, 4, group(8, 132, 106), group(4, 133, 107)),
            version(25, MEDIUM, 4, group(8, 75, 47), group(13, 76, 48)),
            version(25, HIGH, 4, group(7, 54, 24), group(22, 55, 25)),
            version(25, HIGHEST, 4, group(22, 45, 15), group(13, 46, 16)),
            version(26, LOW, 4, group(10, 142, 114), group(2, 143, 115)),
            version(26, MEDIUM, 4, group(19, 74, 46), group(4, 75, 47)),
            version(26, HIGH, 4, group(28, 50, 22), group(6, 51, 23)),
            version(26, HIGHEST, 4, group(33, 46, 16), group(4, 47, 17)),
            version(27, LOW, 4, group(8, 152, 122), group(4, 153, 123)),
            version(27, MEDIUM, 4, group(22, 73, 45), group(3, 74, 46)),
            version(27, HIGH, 4, group(8, 53, 23), group(26, 54, 24)),
            version(27, HIGHEST, 4, group(12, 45, 15), group(28, 46, 16)),
            version(28, LOW, 3, group(3, 147, 117), group(10, 148, 118)),
            version(28, MEDIUM, 3, group(3, 73, 45), group(23, 74, 46)),
            version(28, HIGH, 3, group(4, 54, 24), group(31, 55, 25)),
            version(28, HIGHEST, 3, group(11, 45, 15), group(31, 46, 16)),
            version(29, LOW, 3, group(7, 146, 116), group(7, 147, 117)),
            version(29, MEDIUM, 3, group(21, 73, 45), group(7, 74, 46)),
            version(29, HIGH, 3, group(1, 53, 23), group(37, 54, 24)),
            version(29, HIGHEST, 3, group(19, 45, 15), group(26, 46, 16)),
            version(30, LOW, 3, group(5, 145, 115), group(10, 146, 116)),
            version(30, MEDIUM, 3, group(19, 75, 47), group(10, 76, 48)),
            version(30, HIGH, 3, group(15, 54, 24), group(25, 55, 25)),
            version(30, HIGHEST, 3, group(23, 45, 15), group(25, 46, 16)),
            version(31, LOW, 3, group(13, 145, 115), group(3, 146, 116)),
            version(31, MEDIUM, 3, group(2, 74, 46), group(29, 75, 47)),
            version(31, HIGH, 3, group(42, 54, 24), group(1, 55, 25)),
            version(31, HIGHEST, 3, group(23, 45, 15), group(28, 46, 16)),
            version(32, LOW, 3, group(17, 145, 115)),
            version(32, MEDIUM, 3, group(10, 74, 46), group(23, 75, 47)),
            version(32, HIGH, 3, group(10, 54, 24), group(35, 55, 25)),
            version(32, HIGHEST, 3, group(19, 45, 15), group(35, 46, 16)),
            version(33, LOW, 3, group(17, 145, 115), group(1, 146, 116)),
            version(33, MEDIUM, 3, group(14, 74, 46), group(21, 75, 47)),
            version(33, HIGH, 3, group(29, 54, 24), group(19, 55, 25)),
            version(33, HIGHEST, 3, group(11, 45, 15), group(46, 46, 16)),
            version(34, LOW, 3, group(13, 145, 115), group(6, 146, 116)),
            version(34, MEDIUM, 3, group(14, 74, 46), group(23, 75, 47)),
            version(34, HIGH, 3, group(44, 54, 24), group(7, 55, 25)),
            version(34, HIGHEST, 3, group(59, 46, 16), group(1, 47, 17)),
            version(35, LOW, 0, group(12, 151, 121), group(7, 152, 122)),
            version(35, MEDIUM, 0, group(12, 75, 47), group(26, 76, 48)),
            version(35, HIGH, 0, group(39, 54, 24), group(14, 55, 25)),
            version(35, HIGHEST, 0, group(22, 45, 15), group(41, 46, 16)),
            version(36, LOW, 0, group(6, 151, 121), group(14, 152, 122)),
            version(36, MEDIUM, 0, group(6, 75, 47), group(34, 76, 48)),
            version(36, HIGH, 0, group(46, 54, 24), group(10, 55, 25)),
            version(36, HIGHEST, 0, group(2, 45, 15), group(64, 46, 16)),
            version(37, LOW, 0, group(17, 152, 122), group(4, 153, 123)),
            version(37, MEDIUM, 0, group(29, 74, 46), group(14, 75, 47)),
            version(37, HIGH, 0, group(49, 54, 24), group(10, 55, 25)),
            version(37, HIGHEST, 0, group(24, 45, 15), group(46, 46, 16)),
            version(38, LOW, 0, group(4, 152, 122), group(18, 153, 123)),
            version(38, MEDIUM, 0, group(13, 74, 46), group(32, 75, 47)),
            version(38, HIGH, 0, group(48, 54, 24), group(14, 55, 25)),
            version(38, HIGHEST, 0, group(42, 45, 15), group(32, 46, 16)),
            version(39, LOW, 0, group(20, 147, 117), group(4, 148, 118)),
            version(39, MEDIUM, 0, group(40, 75, 47), group(7, 76, 48)),
            version(39, HIGH, 0, group(43, 54, 24), group(22, 55, 25)),
            version(39, HIGHEST, 0, group(10, 45, 15), group(67, 46, 16)),
            version(40, LOW, 0, group(19, 148, 118), group(6, 149, 119)),
            version(40, MEDIUM, 0, group(18, 75, 47), group(31, 76, 48)),
            version(40, HIGH, 0, group(34, 54, 24), group(34, 55, 25)),
            version(40, HIGHEST, 0, group(20, 45, 15), group(61, 46, 16))
    );

    private QrVersionTable() {}

    /**
     * Returns all 160 records, ordered by version then level.
     */
    public static List<QrVersion> all()
    {
        return VERSIONS;
    }

    /**
     * Returns the record of the given version and level.
     *
     * @throws IllegalArgumentException if {@code version} is outside 1-40
     */
    public static QrVersion get(RecoveryLevel level, int version)
    {
        Objects.requireNonNull(level, "level");
        if (version < 1 || version > 40) {
            throw new IllegalArgumentException("version must be in [1, 40]: " + version);
        }
        return VERSIONS.get((version - 1) * RecoveryLevel.values().length + level.ordinal());
    }

    /**
     * Chooses the smallest version of {@code encoderType}'s bracket whose
     * data capacity at {@code level} holds {@code numDataBits}.
     *
     * @return the chosen version, or empty if none in the bracket is large enough
     */
    public static Optional<QrVersion> choose(RecoveryLevel level, DataEncoderType encoderType, int numDataBits)
    {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(encoderType, "encoderType");

        for (int version = encoderType.minVersion(); version <= encoderType.maxVersion(); version++) {
            QrVersion candidate = get(level, version);
            if (candidate.numDataBits() >= numDataBits) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static QrVersion version(int version, RecoveryLevel level, int remainderBits, BlockGroup... groups)
    {
        return new QrVersion(version, level, List.of(groups), remainderBits);
    }

    private static BlockGroup group(int numBlocks, int numCodewords, int numDataCodewords)
    {
        return new BlockGroup(numBlocks, numCodewords, numDataCodewords);
    }
}
