package com.questrail.qrcode.internal.symbol;

import com.questrail.qrcode.api.RecoveryLevel;
import com.questrail.qrcode.internal.bits.BitVector;
import com.questrail.qrcode.internal.version.BlockGroup;
import com.questrail.qrcode.internal.version.QrVersion;
import com.questrail.qrcode.internal.version.QrVersionTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RegularSymbolBuilderTest
 * -----------------------------------------------------------------------------
 * Structural tests for {@link RegularSymbolBuilder}: every module is written
 * exactly by the placement passes, and the function patterns land where a
 * reader looks for them.
 */
final class RegularSymbolBuilderTest
{
    @Test
    void everyModuleIsWrittenForAllVersionsAndMasks()
    {
        for (int v = 1; v <= 40; v++) {
            QrVersion version = QrVersionTable.get(RecoveryLevel.LOW, v);
            BitVector data = fullData(version, true);

            for (MaskPattern mask : MaskPattern.values()) {
                Symbol s = RegularSymbolBuilder.build(version, mask, data, false);
                assertEquals(0, s.numEmptyModules(), version + " " + mask);
            }
        }
    }

    @Test
    void finderPatternsInThreeCorners()
    {
        QrVersion version = QrVersionTable.get(RecoveryLevel.MEDIUM, 1);
        Symbol s = RegularSymbolBuilder.build(version, MaskPattern.PATTERN_000, fullData(version, false), false);
        int size = s.symbolSize();

        assertFinderPattern(s, 0, 0);
        assertFinderPattern(s, size - 7, 0);
        assertFinderPattern(s, 0, size - 7);

        // Separators
        for (int i = 0; i < 8; i++) {
            assertFalse(s.get(i, 7));
            assertFalse(s.get(7, i));
            assertFalse(s.get(size - 1 - i, 7));
            assertFalse(s.get(i, size - 8));
        }
    }

    @Test
    void timingPatternsAlternate()
    {
        QrVersion version = QrVersionTable.get(RecoveryLevel.LOW, 3);
        Symbol s = RegularSymbolBuilder.build(version, MaskPattern.PATTERN_011, fullData(version, true), false);

        for (int i = 8; i < s.symbolSize() - 8; i++) {
            boolean expected = i % 2 == 0;
            assertEquals(expected, s.get(i, 6), "row 6, column " + i);
            assertEquals(expected, s.get(6, i), "column 6, row " + i);
        }
    }

    @Test
    void darkModuleIsSet()
    {
        QrVersion version = QrVersionTable.get(RecoveryLevel.HIGH, 4);
        Symbol s = RegularSymbolBuilder.build(version, MaskPattern.PATTERN_101, fullData(version, false), false);

        assertTrue(s.get(8, s.symbolSize() - 8));
    }

    @Test
    void formatInformationIsWrittenTwice()
    {
        for (MaskPattern mask : MaskPattern.values()) {
            QrVersion version = QrVersionTable.get(RecoveryLevel.LOW, 1);
            Symbol s = RegularSymbolBuilder.build(version, mask, fullData(version, false), false);
            int size = s.symbolSize();
            int f = version.formatInfo(mask.id());

            for (int i = 0; i <= 7; i++) {
                assertEquals(bit(f, i), s.get(size - 1 - i, 8), "top right, bit " + i);
            }
            for (int i = 8; i <= 14; i++) {
                assertEquals(bit(f, i), s.get(8, size - 15 + i), "bottom left, bit " + i);
            }
            for (int i = 0; i <= 5; i++) {
                assertEquals(bit(f, i), s.get(8, i), "top left, bit " + i);
            }
            for (int i = 9; i <= 14; i++) {
                assertEquals(bit(f, i), s.get(14 - i, 8), "top left, bit " + i);
            }
        }
    }

    @Test
    void versionInformationIsWrittenTwice()
    {
        QrVersion version = QrVersionTable.get(RecoveryLevel.LOW, 7);
        Symbol s = RegularSymbolBuilder.build(version, MaskPattern.PATTERN_000, fullData(version, false), false);
        int size = s.symbolSize();
        int info = version.versionInfo();

        for (int i = 0; i < 18; i++) {
            assertEquals(bit(info, i), s.get(i / 3, size - 11 + i % 3), "bottom left, bit " + i);
            assertEquals(bit(info, i), s.get(size - 11 + i % 3, i / 3), "top right, bit " + i);
        }
    }

    @Test
    void firstDataBitLandsInBottomRightCorner()
    {
        QrVersion version = QrVersionTable.get(RecoveryLevel.LOW, 1);
        BitVector data = fullData(version, false);
        int size = version.symbolSize();

        // Mask 000 flips (0+0)%2: modules where row + column is even
        Symbol s = RegularSymbolBuilder.build(version, MaskPattern.PATTERN_000, data, false);
        assertTrue(s.get(size - 1, size - 1));
        assertFalse(s.get(size - 2, size - 1));
        assertFalse(s.get(size - 1, size - 2));
        assertTrue(s.get(size - 2, size - 2));
    }

    @Test
    void quietZoneIsLight()
    {
        QrVersion version = QrVersionTable.get(RecoveryLevel.LOW, 2);
        Symbol s = RegularSymbolBuilder.build(version, MaskPattern.PATTERN_000, fullData(version, true), true);

        assertEquals(QrVersion.QUIET_ZONE_SIZE, s.quietZoneSize());
        assertEquals(version.symbolSize() + 2 * QrVersion.QUIET_ZONE_SIZE, s.fullSize());

        boolean[][] bitmap = s.bitmap();
        for (int i = 0; i < s.fullSize(); i++) {
            for (int q = 0; q < QrVersion.QUIET_ZONE_SIZE; q++) {
                assertFalse(bitmap[q][i]);
                assertFalse(bitmap[i][q]);
                assertFalse(bitmap[s.fullSize() - 1 - q][i]);
                assertFalse(bitmap[i][s.fullSize() - 1 - q]);
            }
        }
        // The top left finder pattern starts right after the quiet zone
        assertTrue(bitmap[QrVersion.QUIET_ZONE_SIZE][QrVersion.QUIET_ZONE_SIZE]);
    }

    /* Data of exactly the length the placement expects: all codewords plus remainder bits */
    private static BitVector fullData(QrVersion version, boolean value)
    {
        int numCodewords = 0;
        for (BlockGroup g : version.blockGroups()) {
            numCodewords += g.numBlocks() * g.numCodewords();
        }
        return new BitVector().appendRepeated(numCodewords * 8 + version.remainderBits(), value);
    }

    private static void assertFinderPattern(Symbol s, int x0, int y0)
    {
        for (int j = 0; j < 7; j++) {
            for (int i = 0; i < 7; i++) {
                boolean ring = i == 0 || i == 6 || j == 0 || j == 6;
                boolean core = i >= 2 && i <= 4 && j >= 2 && j <= 4;
                assertEquals(ring || core, s.get(x0 + i, y0 + j), "finder at " + x0 + "," + y0);
            }
        }
    }

    private static boolean bit(int value, int i)
    {
        return ((value >>> i) & 1) != 0;
    }
}
