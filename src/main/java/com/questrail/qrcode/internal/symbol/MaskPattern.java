package com.questrail.qrcode.internal.symbol;

/**
 * The eight QR Code data mask patterns (ISO/IEC 18004 Table 10).
 *
 * <p>A data module at row {@code i}, column {@code j} is inverted when the
 * pattern's condition holds. Function patterns are never masked.</p>
 */
public enum MaskPattern
{
    PATTERN_000 {
        @Override
        public boolean isMasked(int i, int j) {
            return (i + j) % 2 == 0;
        }
    },
    PATTERN_001 {
        @Override
        public boolean isMasked(int i, int j) {
            return i % 2 == 0;
        }
    },
    PATTERN_010 {
        @Override
        public boolean isMasked(int i, int j) {
            return j % 3 == 0;
        }
    },
    PATTERN_011 {
        @Override
        public boolean isMasked(int i, int j) {
            return (i + j) % 3 == 0;
        }
    },
    PATTERN_100 {
        @Override
        public boolean isMasked(int i, int j) {
            return (i / 2 + j / 3) % 2 == 0;
        }
    },
    PATTERN_101 {
        @Override
        public boolean isMasked(int i, int j) {
            return (i * j) % 2 + (i * j) % 3 == 0;
        }
    },
    PATTERN_110 {
        @Override
        public boolean isMasked(int i, int j) {
            return ((i * j) % 2 + (i * j) % 3) % 2 == 0;
        }
    },
    PATTERN_111 {
        @Override
        public boolean isMasked(int i, int j) {
            return ((i + j) % 2 + (i * j) % 3) % 2 == 0;
        }
    };

    /**
     * Returns true if the data module at row {@code i}, column {@code j} is inverted.
     */
    public abstract boolean isMasked(int i, int j);

    /**
     * Returns the 3-bit pattern reference written into the Format Information.
     */
    public int id() {
        return ordinal();
    }

    /**
     * Returns the pattern with the given reference.
     *
     * @throws IllegalArgumentException if {@code id} is outside 0-7
     */
    public static MaskPattern fromId(int id) {
        MaskPattern[] all = values();
        if (id < 0 || id >= all.length) {
            throw new IllegalArgumentException("Invalid mask pattern " + id);
        }
        return all[id];
    }
}
