package com.questrail.qrcode.internal.version;

import com.questrail.qrcode.api.RecoveryLevel;
import com.questrail.qrcode.internal.segment.DataEncoderType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QrVersionTableTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link QrVersionTable}, {@link QrVersion} and
 * {@link FormatInformation}.
 */
final class QrVersionTableTest
{
    @Test
    void tableHasEveryVersionAndLevel()
    {
        List<QrVersion> all = QrVersionTable.all();
        assertEquals(160, all.size());

        for (int v = 1; v <= 40; v++) {
            for (RecoveryLevel level : RecoveryLevel.values()) {
                QrVersion record = QrVersionTable.get(level, v);
                assertEquals(v, record.version());
                assertEquals(level, record.level());
            }
        }
    }

    @Test
    void codewordsFillTheSymbol()
    {
        // Modules left for data once all function patterns are placed
        for (QrVersion record : QrVersionTable.all()) {
            int v = record.version();
            int raw = (16 * v + 128) * v + 64;
            if (v >= 2) {
                int numAlign = v / 7 + 2;
                raw -= (25 * numAlign - 10) * numAlign - 55;
                if (v >= 7) {
                    raw -= 36;
                }
            }

            int totalCodewords = 0;
            for (BlockGroup g : record.blockGroups()) {
                totalCodewords += g.numBlocks() * g.numCodewords();
            }
            assertEquals(raw / 8, totalCodewords, record::toString);
            assertEquals(raw % 8, record.remainderBits(), record::toString);
        }
    }

    @Test
    void knownCapacities()
    {
        assertEquals(19 * 8, QrVersionTable.get(RecoveryLevel.LOW, 1).numDataBits());
        assertEquals(9 * 8, QrVersionTable.get(RecoveryLevel.HIGHEST, 1).numDataBits());
        assertEquals(2956 * 8, QrVersionTable.get(RecoveryLevel.LOW, 40).numDataBits());
        assertEquals(1276 * 8, QrVersionTable.get(RecoveryLevel.HIGHEST, 40).numDataBits());

        QrVersion v5q = QrVersionTable.get(RecoveryLevel.HIGH, 5);
        assertEquals(List.of(new BlockGroup(2, 33, 15), new BlockGroup(2, 34, 16)), v5q.blockGroups());
        assertEquals(4, v5q.numBlocks());
        assertEquals(18, v5q.blockGroups().get(0).numErrorCodewords());
    }

    @Test
    void formatInfo()
    {
        assertEquals(0x72f3, QrVersionTable.get(RecoveryLevel.LOW, 1).formatInfo(1));
        assertEquals(0x5e7c, QrVersionTable.get(RecoveryLevel.MEDIUM, 1).formatInfo(2));
        assertEquals(0x3a06, QrVersionTable.get(RecoveryLevel.HIGH, 1).formatInfo(3));
        assertEquals(0x0762, QrVersionTable.get(RecoveryLevel.HIGHEST, 1).formatInfo(4));
        assertEquals(0x6318, QrVersionTable.get(RecoveryLevel.LOW, 1).formatInfo(5));
        assertEquals(0x4f97, QrVersionTable.get(RecoveryLevel.MEDIUM, 1).formatInfo(6));
        assertEquals(0x2bed, QrVersionTable.get(RecoveryLevel.HIGH, 1).formatInfo(7));
    }

    @Test
    void formatInfoRejectsInvalidMask()
    {
        assertThrows(IllegalArgumentException.class, () -> FormatInformation.formatInfo(RecoveryLevel.LOW, 8));
        assertThrows(IllegalArgumentException.class, () -> FormatInformation.formatInfo(RecoveryLevel.LOW, -1));
    }

    @Test
    void versionInfo()
    {
        assertEquals(0x07c94, QrVersionTable.get(RecoveryLevel.LOW, 7).versionInfo());
        assertEquals(0x0a4d3, QrVersionTable.get(RecoveryLevel.LOW, 10).versionInfo());
        assertEquals(0x149a6, QrVersionTable.get(RecoveryLevel.LOW, 20).versionInfo());
        assertEquals(0x1ed75, QrVersionTable.get(RecoveryLevel.LOW, 30).versionInfo());
        assertEquals(0x28c69, QrVersionTable.get(RecoveryLevel.LOW, 40).versionInfo());
    }

    @Test
    void smallVersionsCarryNoVersionInfo()
    {
        QrVersion v6 = QrVersionTable.get(RecoveryLevel.LOW, 6);
        assertFalse(v6.hasVersionInfo());
        assertThrows(IllegalStateException.class, v6::versionInfo);
        assertTrue(QrVersionTable.get(RecoveryLevel.LOW, 7).hasVersionInfo());
    }

    @Test
    void numBitsToPadToCodeword()
    {
        QrVersion v1 = QrVersionTable.get(RecoveryLevel.LOW, 1);
        assertEquals(0, v1.numBitsToPadToCodeword(0));
        assertEquals(7, v1.numBitsToPadToCodeword(1));
        assertEquals(1, v1.numBitsToPadToCodeword(7));
        assertEquals(0, v1.numBitsToPadToCodeword(8));
        assertEquals(0, v1.numBitsToPadToCodeword(v1.numDataBits()));
    }

    @Test
    void terminatorShrinksAtCapacity()
    {
        QrVersion v1 = QrVersionTable.get(RecoveryLevel.LOW, 1);
        assertEquals(4, v1.numTerminatorBitsRequired(100));
        assertEquals(2, v1.numTerminatorBitsRequired(v1.numDataBits() - 2));
        assertEquals(0, v1.numTerminatorBitsRequired(v1.numDataBits()));
    }

    @Test
    void chooseSmallestFittingVersion()
    {
        assertEquals(Optional.of(QrVersionTable.get(RecoveryLevel.LOW, 1)),
                QrVersionTable.choose(RecoveryLevel.LOW, DataEncoderType.VERSIONS_1_TO_9, 152));
        assertEquals(Optional.of(QrVersionTable.get(RecoveryLevel.LOW, 2)),
                QrVersionTable.choose(RecoveryLevel.LOW, DataEncoderType.VERSIONS_1_TO_9, 153));
        assertEquals(Optional.of(QrVersionTable.get(RecoveryLevel.LOW, 10)),
                QrVersionTable.choose(RecoveryLevel.LOW, DataEncoderType.VERSIONS_10_TO_26, 1));
    }

    @Test
    void chooseStaysWithinBracket()
    {
        int v9 = QrVersionTable.get(RecoveryLevel.LOW, 9).numDataBits();
        assertTrue(QrVersionTable.choose(RecoveryLevel.LOW, DataEncoderType.VERSIONS_1_TO_9, v9 + 1).isEmpty());
    }

    @Test
    void symbolSize()
    {
        assertEquals(21, QrVersionTable.get(RecoveryLevel.LOW, 1).symbolSize());
        assertEquals(25, QrVersionTable.get(RecoveryLevel.LOW, 2).symbolSize());
        assertEquals(177, QrVersionTable.get(RecoveryLevel.LOW, 40).symbolSize());
    }

    @Test
    void getRejectsUnknownVersion()
    {
        assertThrows(IllegalArgumentException.class, () -> QrVersionTable.get(RecoveryLevel.LOW, 0));
        assertThrows(IllegalArgumentException.class, () -> QrVersionTable.get(RecoveryLevel.LOW, 41));
    }

    @Test
    void toStringNamesVersionAndLevel()
    {
        assertEquals("1-LOW", QrVersionTable.get(RecoveryLevel.LOW, 1).toString());
    }
}
