package com.questrail.qrcode.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * QrMatrix
 * -----------------------------------------------------------------------------
 * Immutable module matrix of an encoded QR Code symbol.
 *
 * <h2>What this represents</h2>
 * The finished symbol, including the quiet zone (if any), as a square grid of
 * dark ({@code true}) and light ({@code false}) modules. {@code get(x, y)}
 * addresses column {@code x} of row {@code y}; (0, 0) is the top left corner
 * of the quiet zone.
 *
 * Immutability is enforced via defensive copying.
 */
public final class QrMatrix
{
    private final boolean[][] modules;
    private final int version;
    private final RecoveryLevel level;
    private final int maskPattern;
    private final int quietZoneSize;

    public QrMatrix(boolean[][] modules,
                    int version,
                    RecoveryLevel level,
                    int maskPattern,
                    int quietZoneSize)
    {
        Objects.requireNonNull(modules, "modules");
        this.level = Objects.requireNonNull(level, "level");

        if (version < 1 || version > 40) {
            throw new IllegalArgumentException("version must be in [1, 40]: " + version);
        }
        if (maskPattern < 0 || maskPattern > 7) {
            throw new IllegalArgumentException("maskPattern must be in [0, 7]: " + maskPattern);
        }
        final int expectedSize = 21 + 4 * (version - 1) + 2 * quietZoneSize;
        if (modules.length != expectedSize) {
            throw new IllegalArgumentException(
                    "Expected " + expectedSize + " rows, got " + modules.length);
        }

        this.modules = new boolean[modules.length][];
        for (int y = 0; y < modules.length; y++) {
            if (modules[y].length != expectedSize) {
                throw new IllegalArgumentException("Row " + y + " is not " + expectedSize + " modules wide");
            }
            this.modules[y] = modules[y].clone();
        }
        this.version = version;
        this.maskPattern = maskPattern;
        this.quietZoneSize = quietZoneSize;
    }

    /**
     * Returns the width (and height) of the matrix in modules, quiet zone included.
     */
    public int size() {
        return modules.length;
    }

    /**
     * Returns true if the module at column {@code x}, row {@code y} is dark.
     */
    public boolean get(int x, int y) {
        return modules[y][x];
    }

    /**
     * Returns a copy of the matrix as {@code bitmap[y][x]}.
     */
    public boolean[][] bitmap() {
        boolean[][] copy = new boolean[modules.length][];
        for (int y = 0; y < modules.length; y++) {
            copy[y] = modules[y].clone();
        }
        return copy;
    }

    /**
     * Returns the QR Code version number (1-40).
     */
    public int version() {
        return version;
    }

    public RecoveryLevel level() {
        return level;
    }

    /**
     * Returns the id (0-7) of the data mask chosen for this symbol.
     */
    public int maskPattern() {
        return maskPattern;
    }

    /**
     * Returns the width of the light border on each side, zero if disabled.
     */
    public int quietZoneSize() {
        return quietZoneSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QrMatrix other)) {
            return false;
        }
        return version == other.version
                && level == other.level
                && maskPattern == other.maskPattern
                && quietZoneSize == other.quietZoneSize
                && Arrays.deepEquals(modules, other.modules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, level, maskPattern, quietZoneSize, Arrays.deepHashCode(modules));
    }

    /**
     * Renders the matrix with {@code #} for dark and {@code .} for light
     * modules, one row per line.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(modules.length * (modules.length + 1));
        for (boolean[] row : modules) {
            for (boolean dark : row) {
                sb.append(dark ? '#' : '.');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
