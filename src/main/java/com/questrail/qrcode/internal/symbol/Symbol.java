package com.questrail.qrcode.internal.symbol;

/**
 * Symbol
 * -----------------------------------------------------------------------------
 * Square module grid of a QR Code symbol surrounded by a quiet zone.
 *
 * <p>Coordinates passed to {@link #get}, {@link #set} and {@link #isEmpty}
 * ignore the quiet zone: (0, 0) is the top left module of the symbol proper.
 * {@link #bitmap()} returns the whole grid including the quiet zone.</p>
 *
 * <pre>
 *   symbolSize=2, quietZoneSize=1:
 *
 *   +----+
 *   |    |
 *   | ab |     (0,0)=a  (1,0)=b
 *   | cd |     (0,1)=c  (1,1)=d
 *   |    |
 *   +----+
 * </pre>
 *
 * <p>Each module has a value and a used flag. A finished symbol has every
 * module of the symbol proper marked used.</p>
 *
 * This class is mutable and makes no thread-safety guarantees.
 */
public final class Symbol
{
    /* [y][x], quiet zone included; true is dark */
    private final boolean[][] modules;

    /* [y][x], quiet zone included */
    private final boolean[][] used;

    private final int symbolSize;
    private final int quietZoneSize;

    public Symbol(int symbolSize, int quietZoneSize)
    {
        if (symbolSize < 1) {
            throw new IllegalArgumentException("symbolSize must be positive");
        }
        if (quietZoneSize < 0) {
            throw new IllegalArgumentException("quietZoneSize must be non-negative");
        }
        final int fullSize = symbolSize + 2 * quietZoneSize;
        this.modules = new boolean[fullSize][fullSize];
        this.used = new boolean[fullSize][fullSize];
        this.symbolSize = symbolSize;
        this.quietZoneSize = quietZoneSize;
    }

    public int symbolSize()
    {
        return symbolSize;
    }

    public int quietZoneSize()
    {
        return quietZoneSize;
    }

    /**
     * Returns the width of the symbol plus both quiet zones.
     */
    public int fullSize()
    {
        return modules.length;
    }

    public boolean get(int x, int y)
    {
        return modules[y + quietZoneSize][x + quietZoneSize];
    }

    /**
     * Returns true if the module at (x, y) has not been written yet.
     */
    public boolean isEmpty(int x, int y)
    {
        return !used[y + quietZoneSize][x + quietZoneSize];
    }

    public void set(int x, int y, boolean value)
    {
        modules[y + quietZoneSize][x + quietZoneSize] = value;
        used[y + quietZoneSize][x + quietZoneSize] = true;
    }

    /**
     * Writes {@code pattern} with its top left corner at (x, y).
     * {@code pattern} is indexed {@code [row][column]}.
     */
    public void setPattern(int x, int y, boolean[][] pattern)
    {
        for (int j = 0; j < pattern.length; j++) {
            for (int i = 0; i < pattern[j].length; i++) {
                set(x + i, y + j, pattern[j][i]);
            }
        }
    }

    /**
     * Returns the number of modules of the symbol proper not written yet.
     */
    public int numEmptyModules()
    {
        int count = 0;
        for (int y = 0; y < symbolSize; y++) {
            for (int x = 0; x < symbolSize; x++) {
                if (isEmpty(x, y)) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Returns a copy of the whole grid, quiet zone included, as {@code [y][x]}.
     */
    public boolean[][] bitmap()
    {
        boolean[][] copy = new boolean[modules.length][];
        for (int y = 0; y < modules.length; y++) {
            copy[y] = modules[y].clone();
        }
        return copy;
    }
}
