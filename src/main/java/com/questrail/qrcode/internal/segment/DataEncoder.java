package com.questrail.qrcode.internal.segment;

import com.questrail.qrcode.internal.bits.BitVector;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DataEncoder
 * -----------------------------------------------------------------------------
 * Converts raw content bytes into the QR Code data bitstream for one
 * {@link DataEncoderType} bracket.
 *
 * <p>Encoding runs in three passes:</p>
 * <ol>
 *   <li><b>Classify</b> each byte into the most restrictive {@link DataMode}
 *       and merge adjacent bytes of the same mode into segments.</li>
 *   <li><b>Optimise</b> by absorbing following, less general segments into the
 *       current one whenever the coalesced segment is strictly shorter than the
 *       two separate ones (saving a mode indicator and count field).</li>
 *   <li><b>Fallback</b> to a single segment in the most general required mode
 *       if that is no longer than the optimised list.</li>
 * </ol>
 *
 * <h2>What this encoder does NOT do</h2>
 * <ul>
 *   <li>Choose the QR Code version</li>
 *   <li>Append terminator or pad bits</li>
 * </ul>
 *
 * <h2>Mutability</h2>
 * A {@code DataEncoder} keeps the segments of its last {@link #encode} call
 * and is intended for a single encode call on a single thread.
 */
public final class DataEncoder
{
    private final DataEncoderType type;

    private final List<Segment> classified = new ArrayList<>();
    private final List<Segment> optimised = new ArrayList<>();

    public DataEncoder(DataEncoderType type)
    {
        this.type = Objects.requireNonNull(type, "type");
    }

    public DataEncoderType type()
    {
        return type;
    }

    /**
     * Encodes {@code content} as mode indicator, count and payload segments.
     *
     * @return the encoded bitstream, or empty if a segment does not fit the
     *         character count field of this bracket
     * @throws IllegalArgumentException if {@code content} is empty
     */
    public Optional<BitVector> encode(byte[] content)
    {
        Objects.requireNonNull(content, "content");
        if (content.length == 0) {
            throw new IllegalArgumentException("No content to encode");
        }

        classified.clear();
        optimised.clear();

        try {
            final DataMode highestRequiredMode = classify(content);
            optimise();

            int optimisedLength = 0;
            for (Segment s : optimised) {
                optimisedLength += type.encodedLength(s.mode(), s.length());
            }

            final int singleSegmentLength = type.encodedLength(highestRequiredMode, content.length);
            if (singleSegmentLength <= optimisedLength) {
                optimised.clear();
                optimised.add(new Segment(highestRequiredMode, content));
            }
        }
        catch (SegmentLengthException e) {
            // Count field too narrow → a wider bracket has to take over
            return Optional.empty();
        }

        BitVector encoded = new BitVector();
        for (Segment s : optimised) {
            appendSegment(s, encoded);
        }
        return Optional.of(encoded);
    }

    /**
     * Returns the segments produced by the classification pass of the last
     * {@link #encode} call.
     */
    public List<Segment> classifiedSegments()
    {
        return List.copyOf(classified);
    }

    /**
     * Returns the segments actually encoded by the last {@link #encode} call.
     */
    public List<Segment> optimisedSegments()
    {
        return List.copyOf(optimised);
    }

    /**
     * Appends a single segment (mode indicator, character count, payload).
     */
    public void appendSegment(Segment segment, BitVector encoded)
    {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(encoded, "encoded");

        final DataMode mode = segment.mode();
        final byte[] data = segment.data();

        encoded.appendNumber(mode.indicator(), DataMode.INDICATOR_BITS);
        encoded.appendNumber(data.length, type.charCountBits(mode));

        switch (mode) {
            case NUMERIC -> {
                // 3 digits → 10 bits, 2 → 7 bits, 1 → 4 bits
                for (int i = 0; i < data.length; i += 3) {
                    int value = 0;
                    int numBits = 1;
                    for (int j = i; j < data.length && j < i + 3; j++) {
                        value = value * 10 + ((data[j] & 0xFF) - '0');
                        numBits += 3;
                    }
                    encoded.appendNumber(value, numBits);
                }
            }
            case ALPHANUMERIC -> {
                // pair → 11 bits, single → 6 bits
                for (int i = 0; i < data.length; i += 2) {
                    int value = 0;
                    for (int j = i; j < data.length && j < i + 2; j++) {
                        value = value * 45 + DataMode.alphanumericValue(data[j] & 0xFF);
                    }
                    encoded.appendNumber(value, data.length - i > 1 ? 11 : 6);
                }
            }
            case BYTE -> encoded.appendBytes(data);
        }
    }

    private DataMode classify(byte[] content)
    {
        DataMode mode = DataMode.classify(content[0]);
        DataMode highest = mode;
        int start = 0;

        for (int i = 1; i < content.length; i++) {
            DataMode next = DataMode.classify(content[i]);
            if (next != mode) {
                classified.add(new Segment(mode, Arrays.copyOfRange(content, start, i)));
                start = i;
                mode = next;
            }
            if (next.compareTo(highest) > 0) {
                highest = next;
            }
        }
        classified.add(new Segment(mode, Arrays.copyOfRange(content, start, content.length)));
        return highest;
    }

    private void optimise()
            throws SegmentLengthException
    {
        int i = 0;
        while (i < classified.size()) {
            final DataMode mode = classified.get(i).mode();
            int numChars = classified.get(i).length();

            int j = i + 1;
            while (j < classified.size()) {
                final Segment next = classified.get(j);
                if (next.mode().compareTo(mode) > 0) {
                    break;
                }

                int coalesced = type.encodedLength(mode, numChars + next.length());
                int separate = type.encodedLength(mode, numChars)
                        + type.encodedLength(next.mode(), next.length());

                if (coalesced >= separate) {
                    break;
                }
                numChars += next.length();
                j++;
            }

            ByteArrayOutputStream merged = new ByteArrayOutputStream(numChars);
            for (int k = i; k < j; k++) {
                merged.writeBytes(classified.get(k).data());
            }
            optimised.add(new Segment(mode, merged.toByteArray()));
            i = j;
        }
    }
}
