package com.questrail.qrcode.internal.bits;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BitVectorTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link BitVector}.
 *
 * <p>Bits are compared through {@link BitVector#toBooleans()} so failures show
 * the offending positions.</p>
 */
final class BitVectorTest
{
    private static final boolean B0 = false;
    private static final boolean B1 = true;

    @Test
    void ofKeepsOrderAndLength()
    {
        boolean[] bits = { B0, B0, B1 };
        BitVector v = BitVector.of(bits);

        assertEquals(3, v.length());
        assertArrayEquals(bits, v.toBooleans());
    }

    @Test
    void emptyVector()
    {
        BitVector v = new BitVector();
        assertEquals(0, v.length());
        assertArrayEquals(new boolean[0], v.toBooleans());
        assertEquals("numBits=0", v.toString());
    }

    @Test
    void appendVectorAtEverySplitPoint()
    {
        boolean[] random = randomBools(128);

        for (int i = 0; i < random.length - 1; i++) {
            BitVector a = BitVector.of(Arrays.copyOfRange(random, 0, i));
            BitVector b = BitVector.of(Arrays.copyOfRange(random, i, random.length));

            a.append(b);
            assertArrayEquals(random, a.toBooleans(), "split at " + i);
        }
    }

    @Test
    void appendBoolsAtEverySplitPoint()
    {
        boolean[] random = randomBools(128);

        for (int i = 0; i < random.length - 1; i++) {
            BitVector a = BitVector.of(Arrays.copyOfRange(random, 0, i));
            a.appendBools(Arrays.copyOfRange(random, i, random.length));

            assertArrayEquals(random, a.toBooleans(), "split at " + i);
        }
    }

    @Test
    void appendByteUsesLowBitsMostSignificantFirst()
    {
        assertEquals(BitVector.of(B1), new BitVector().appendByte(0x01, 1));
        assertEquals(BitVector.of(B0, B1), BitVector.of(B0).appendByte(0x01, 1));

        BitVector prefix = BitVector.of(B1, B0, B1, B0, B1, B0, B1);
        assertEquals(BitVector.parse("1010101 10"), prefix.copy().appendByte(0xAA, 2));
        assertEquals(BitVector.parse("1010101 10101010"), prefix.copy().appendByte(0xAA, 8));
    }

    @Test
    void appendNumber()
    {
        assertEquals(BitVector.parse("1111"), new BitVector().appendNumber(0xAAAAAAAFL, 4));
        assertEquals(BitVector.parse("10101010 10101010 10101010 10101010"),
                new BitVector().appendNumber(0xAAAAAAAAL, 32));
        assertEquals(BitVector.parse("0101010 10101010 10101010 10101010"),
                new BitVector().appendNumber(0xAAAAAAAAL, 31));

        BitVector zeros = new BitVector().appendNumber(0, 32);
        assertEquals(32, zeros.length());
        for (boolean b : zeros.toBooleans()) {
            assertFalse(b);
        }
    }

    @Test
    void appendNumberRejectsWideFields()
    {
        assertThrows(IllegalArgumentException.class, () -> new BitVector().appendNumber(1, 33));
        assertThrows(IllegalArgumentException.class, () -> new BitVector().appendByte(1, 9));
    }

    @Test
    void appendRepeated()
    {
        BitVector v = BitVector.of(B1).appendRepeated(3, false).appendRepeated(2, true);
        assertEquals(BitVector.parse("100011"), v);
        assertThrows(IllegalArgumentException.class, () -> v.appendRepeated(-1, true));
    }

    @Test
    void appendBytesWritesWholeBytes()
    {
        BitVector v = new BitVector().appendBytes(new byte[] { (byte) 0xEC, 0x11 });
        assertEquals(BitVector.parse("11101100 00010001"), v);
    }

    @Test
    void mixedAppends()
    {
        BitVector v = new BitVector();
        v.appendBools(true, true, false);
        v.appendBools(true);
        v.appendByte(0x02, 4);

        assertArrayEquals(new boolean[] { B1, B1, B0, B1, B0, B0, B1, B0 }, v.toBooleans());
    }

    @Test
    void getReadsEachPosition()
    {
        boolean[] bits = { B0, B1, B0, B1, B0, B1, B1, B0, B1 };
        BitVector v = BitVector.of(bits);

        for (int i = 0; i < bits.length; i++) {
            assertEquals(bits[i], v.get(i), "bit " + i);
        }
        assertThrows(IndexOutOfBoundsException.class, () -> v.get(bits.length));
    }

    @Test
    void byteAtRightAlignsShortTail()
    {
        BitVector v = BitVector.of(B0, B1, B0, B1, B0, B1, B1, B0, B1);

        assertEquals(0x56, v.byteAt(0));
        assertEquals(0xad, v.byteAt(1));
        assertEquals(0x2d, v.byteAt(2));
        assertEquals(0x0d, v.byteAt(5));
        assertEquals(0x01, v.byteAt(8));
    }

    @Test
    void substring()
    {
        BitVector v = BitVector.of(B0, B1, B0, B1, B0, B1, B1, B0);

        assertEquals(v, v.substring(0, 8));
        assertEquals(new BitVector(), v.substring(0, 0));
        assertEquals(BitVector.of(B0), v.substring(0, 1));
        assertEquals(BitVector.of(B0, B1), v.substring(2, 4));
        assertThrows(IndexOutOfBoundsException.class, () -> v.substring(4, 9));
    }

    @Test
    void substringKeepsTrailingZeros()
    {
        BitVector v = BitVector.parse("1000 0000");
        assertEquals(8, v.substring(0, 8).length());
        assertEquals(3, v.substring(5, 8).length());
    }

    @Test
    void copyIsIndependent()
    {
        BitVector original = BitVector.parse("101");
        BitVector copy = original.copy();
        copy.append(true);

        assertEquals(3, original.length());
        assertEquals(4, copy.length());
    }

    @Test
    void equalityConsidersLength()
    {
        assertNotEquals(BitVector.parse("1"), BitVector.parse("10"));
        assertEquals(BitVector.parse("10"), BitVector.parse("1 0"));
        assertEquals(BitVector.parse("10").hashCode(), BitVector.parse("1 0").hashCode());
    }

    @Test
    void parseRejectsOtherCharacters()
    {
        assertThrows(IllegalArgumentException.class, () -> BitVector.parse("10x1"));
    }

    @Test
    void toStringGroupsByEight()
    {
        assertEquals("numBits=10 01010110 11", BitVector.parse("0101011011").toString());
    }

    private static boolean[] randomBools(int n)
    {
        Random rng = new Random(1);
        boolean[] result = new boolean[n];
        for (int i = 0; i < n; i++) {
            result[i] = rng.nextBoolean();
        }
        return result;
    }
}
