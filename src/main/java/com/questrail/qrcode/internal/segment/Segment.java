package com.questrail.qrcode.internal.segment;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Segment
 * -----------------------------------------------------------------------------
 * A run of content bytes encoded with a single {@link DataMode}.
 *
 * Immutability is enforced via defensive copying.
 */
public final class Segment
{
    private final DataMode mode;
    private final byte[] data;

    public Segment(DataMode mode, byte[] data) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    public DataMode mode() {
        return mode;
    }

    /**
     * Returns a copy of the segment bytes.
     */
    public byte[] data() {
        return data.clone();
    }

    /**
     * Returns the number of characters (bytes) in this segment.
     */
    public int length() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Segment other)) {
            return false;
        }
        return mode == other.mode && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * mode.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return data.length + "*" + mode + (mode == DataMode.BYTE
                ? ""
                : "(" + new String(data, StandardCharsets.US_ASCII) + ")");
    }
}
