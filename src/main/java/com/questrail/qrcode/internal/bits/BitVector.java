package com.questrail.qrcode.internal.bits;

import java.util.BitSet;
import java.util.Objects;

/**
 * BitVector
 * -----------------------------------------------------------------------------
 * Append-only, MSB-first bit sequence backed by {@link BitSet}.
 *
 * <p>Every bitstream producer in the encoder (segment encoding, padding,
 * Reed-Solomon blocks, interleaving) writes into a {@code BitVector}. Bits are
 * numbered in transmission order: bit 0 is the first bit appended.</p>
 *
 * <h2>Internal Representation</h2>
 * A {@link BitSet} holds the set bits and {@code length} tracks the logical
 * size, since {@link BitSet#length()} ignores trailing zero bits.
 *
 * <h2>Mutability</h2>
 * Mutable while being built and not thread-safe. Each encode call owns its
 * own vectors.
 */
public final class BitVector
{
    private final BitSet bits;
    private int length;

    public BitVector()
    {
        this.bits = new BitSet();
        this.length = 0;
    }

    /**
     * Creates a vector holding the given bits in order.
     */
    public static BitVector of(boolean... values)
    {
        BitVector result = new BitVector();
        result.appendBools(values);
        return result;
    }

    /**
     * Parses a string of {@code 0} and {@code 1} characters. Spaces are
     * ignored, so groups can be separated for readability.
     *
     * @throws IllegalArgumentException for any other character
     */
    public static BitVector parse(String base2)
    {
        Objects.requireNonNull(base2, "base2");
        BitVector result = new BitVector();
        for (int i = 0; i < base2.length(); i++) {
            char c = base2.charAt(i);
            switch (c) {
                case '0' -> result.append(false);
                case '1' -> result.append(true);
                case ' ' -> { }
                default -> throw new IllegalArgumentException(
                        "Invalid character '" + c + "' in base-2 string");
            }
        }
        return result;
    }

    /**
     * Returns an independent copy of this vector.
     */
    public BitVector copy()
    {
        BitVector result = new BitVector();
        result.bits.or(this.bits);
        result.length = this.length;
        return result;
    }

    public int length()
    {
        return length;
    }

    /**
     * Returns the bit at {@code index}.
     *
     * @throws IndexOutOfBoundsException if index is outside {@code [0, length)}
     */
    public boolean get(int index)
    {
        Objects.checkIndex(index, length);
        return bits.get(index);
    }

    /**
     * Reads up to 8 bits starting at {@code index}, MSB first.
     *
     * <p>If fewer than 8 bits remain the available bits are returned
     * right-aligned.</p>
     */
    public int byteAt(int index)
    {
        Objects.checkIndex(index, length);
        int result = 0;
        for (int i = index; i < index + 8 && i < length; i++) {
            result <<= 1;
            if (bits.get(i)) {
                result |= 1;
            }
        }
        return result;
    }

    /**
     * Returns a new vector holding bits {@code [start, end)}.
     */
    public BitVector substring(int start, int end)
    {
        Objects.checkFromToIndex(start, end, length);
        BitVector result = new BitVector();
        result.bits.or(bits.get(start, end));
        result.length = end - start;
        return result;
    }

    public BitVector append(boolean value)
    {
        if (value) {
            bits.set(length);
        }
        length++;
        return this;
    }

    public BitVector appendBools(boolean... values)
    {
        for (boolean v : values) {
            append(v);
        }
        return this;
    }

    /**
     * Appends {@code count} copies of {@code value}.
     */
    public BitVector appendRepeated(int count, boolean value)
    {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        if (value) {
            bits.set(length, length + count);
        }
        length += count;
        return this;
    }

    public BitVector append(BitVector other)
    {
        Objects.requireNonNull(other, "other");
        for (int i = other.bits.nextSetBit(0); i >= 0 && i < other.length; i = other.bits.nextSetBit(i + 1)) {
            bits.set(length + i);
        }
        length += other.length;
        return this;
    }

    /**
     * Appends the {@code numBits} least significant bits of {@code value},
     * most significant of those first.
     */
    public BitVector appendByte(int value, int numBits)
    {
        if (numBits < 0 || numBits > 8) {
            throw new IllegalArgumentException("numBits must be in [0, 8]: " + numBits);
        }
        return appendNumber(value & 0xFF, numBits);
    }

    /**
     * Appends the {@code numBits} least significant bits of {@code value},
     * most significant of those first. Up to 32 bits.
     */
    public BitVector appendNumber(long value, int numBits)
    {
        if (numBits < 0 || numBits > 32) {
            throw new IllegalArgumentException("numBits must be in [0, 32]: " + numBits);
        }
        for (int i = numBits - 1; i >= 0; i--) {
            append(((value >>> i) & 1L) != 0);
        }
        return this;
    }

    /**
     * Appends whole bytes, 8 bits each.
     */
    public BitVector appendBytes(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        for (byte b : data) {
            appendByte(b, 8);
        }
        return this;
    }

    /**
     * Returns the bits as a boolean array.
     */
    public boolean[] toBooleans()
    {
        boolean[] result = new boolean[length];
        for (int i = 0; i < length; i++) {
            result[i] = bits.get(i);
        }
        return result;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitVector other)) {
            return false;
        }
        return length == other.length && bits.equals(other.bits);
    }

    @Override
    public int hashCode()
    {
        return 31 * length + bits.hashCode();
    }

    /**
     * Renders the bits in groups of eight, e.g. {@code "numBits=10 01010110 11"}.
     */
    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("numBits=").append(length);
        for (int i = 0; i < length; i++) {
            if (i % 8 == 0) {
                sb.append(' ');
            }
            sb.append(bits.get(i) ? '1' : '0');
        }
        return sb.toString();
    }
}
