package com.questrail.qrcode.internal.symbol;

import java.util.Objects;

/**
 * PenaltyScorer
 * -----------------------------------------------------------------------------
 * Computes the mask evaluation penalty of a finished {@link Symbol}
 * (ISO/IEC 18004:2006 Section 6.8.2.1). Lower is better.
 *
 * <ul>
 *   <li><b>Rule 1</b>: runs of same-coloured modules in a row or column.
 *       A run reaching 6 modules scores {@code N1 + 1}, each further module 1.</li>
 *   <li><b>Rule 2</b>: every 2x2 block of same-coloured modules scores {@code N2}.</li>
 *   <li><b>Rule 3</b>: every {@code 1:1:3:1:1} dark/light pattern with a
 *       4-module light run on either side scores {@code N3}.</li>
 *   <li><b>Rule 4</b>: {@code N4} for each full 5% the dark ratio deviates from 50%.</li>
 * </ul>
 *
 * <p>The quiet zone is not scored.</p>
 */
public final class PenaltyScorer
{
    static final int N1 = 3;
    static final int N2 = 3;
    static final int N3 = 40;
    static final int N4 = 10;

    /* 0000 1011101 and 1011101 0000, read as the last 11 modules */
    private static final int FINDER_LIKE_BEFORE = 0x05d;
    private static final int FINDER_LIKE_AFTER = 0x5d0;
    private static final int FINDER_LIKE_CORE = 0x5d;

    private PenaltyScorer() {}

    /**
     * Returns the sum of the four penalty rules.
     */
    public static int score(Symbol symbol)
    {
        Objects.requireNonNull(symbol, "symbol");
        return adjacentRuns(symbol) + sameColourBlocks(symbol) + finderLikePatterns(symbol) + darkRatio(symbol);
    }

    static int adjacentRuns(Symbol s)
    {
        final int size = s.symbolSize();
        int penalty = 0;

        for (int x = 0; x < size; x++) {
            penalty += runPenalty(s, x, 0, 0, 1);
        }
        for (int y = 0; y < size; y++) {
            penalty += runPenalty(s, 0, y, 1, 0);
        }
        return penalty;
    }

    private static int runPenalty(Symbol s, int x0, int y0, int dx, int dy)
    {
        final int size = s.symbolSize();
        int penalty = 0;

        boolean last = s.get(x0, y0);
        int count = 1;

        for (int k = 1; k < size; k++) {
            boolean v = s.get(x0 + k * dx, y0 + k * dy);
            if (v != last) {
                count = 1;
                last = v;
                continue;
            }
            count++;
            if (count == 6) {
                penalty += N1 + 1;
            } else if (count > 6) {
                penalty++;
            }
        }
        return penalty;
    }

    static int sameColourBlocks(Symbol s)
    {
        final int size = s.symbolSize();
        int blocks = 0;

        for (int y = 1; y < size; y++) {
            for (int x = 1; x < size; x++) {
                boolean current = s.get(x, y);
                if (current == s.get(x - 1, y - 1)
                        && current == s.get(x, y - 1)
                        && current == s.get(x - 1, y)) {
                    blocks++;
                }
            }
        }
        return blocks * N2;
    }

    static int finderLikePatterns(Symbol s)
    {
        final int size = s.symbolSize();
        int penalty = 0;

        for (int y = 0; y < size; y++) {
            penalty += finderLikePenalty(s, 0, y, 1, 0);
        }
        for (int x = 0; x < size; x++) {
            penalty += finderLikePenalty(s, x, 0, 0, 1);
        }
        return penalty;
    }

    private static int finderLikePenalty(Symbol s, int x0, int y0, int dx, int dy)
    {
        final int size = s.symbolSize();
        int penalty = 0;
        int window = 0;

        for (int k = 0; k < size; k++) {
            window <<= 1;
            if (s.get(x0 + k * dx, y0 + k * dy)) {
                window |= 1;
            }

            int last11 = window & 0x7ff;
            if (last11 == FINDER_LIKE_BEFORE || last11 == FINDER_LIKE_AFTER) {
                penalty += N3;
                window = 0xff;
            } else if (k == size - 1 && (window & 0x7f) == FINDER_LIKE_CORE) {
                // Pattern touching the symbol edge counts as bordered by the quiet zone
                penalty += N3;
                window = 0xff;
            }
        }
        return penalty;
    }

    static int darkRatio(Symbol s)
    {
        final int size = s.symbolSize();
        final int numModules = size * size;
        int numDark = 0;

        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                if (s.get(x, y)) {
                    numDark++;
                }
            }
        }

        int deviation = Math.abs(numModules / 2 - numDark);
        return N4 * (deviation / (numModules / 20));
    }
}
