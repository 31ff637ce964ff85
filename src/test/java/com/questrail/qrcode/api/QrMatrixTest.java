package com.questrail.qrcode.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QrMatrixTest
{
    @Test
    void sizeMustMatchVersionAndQuietZone()
    {
        assertDoesNotThrow(() -> new QrMatrix(new boolean[21][21], 1, RecoveryLevel.LOW, 0, 0));
        assertDoesNotThrow(() -> new QrMatrix(new boolean[29][29], 1, RecoveryLevel.LOW, 0, 4));

        assertThrows(IllegalArgumentException.class,
                () -> new QrMatrix(new boolean[21][21], 2, RecoveryLevel.LOW, 0, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new QrMatrix(new boolean[21][20], 1, RecoveryLevel.LOW, 0, 0));
    }

    @Test
    void invalidVersionOrMaskIsRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new QrMatrix(new boolean[17][17], 0, RecoveryLevel.LOW, 0, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new QrMatrix(new boolean[21][21], 1, RecoveryLevel.LOW, 8, 0));
    }

    @Test
    void inputGridIsCopied()
    {
        boolean[][] grid = new boolean[21][21];
        QrMatrix matrix = new QrMatrix(grid, 1, RecoveryLevel.HIGH, 3, 0);

        grid[0][0] = true;

        assertFalse(matrix.get(0, 0));
    }

    @Test
    void getAddressesColumnThenRow()
    {
        boolean[][] grid = new boolean[21][21];
        grid[2][5] = true;
        QrMatrix matrix = new QrMatrix(grid, 1, RecoveryLevel.LOW, 0, 0);

        assertTrue(matrix.get(5, 2));
        assertFalse(matrix.get(2, 5));
    }

    @Test
    void toStringRendersRows()
    {
        boolean[][] grid = new boolean[21][21];
        grid[0][1] = true;
        String[] lines = new QrMatrix(grid, 1, RecoveryLevel.LOW, 0, 0).toString().split("\n");

        assertEquals(21, lines.length);
        assertEquals("." + "#" + ".".repeat(19), lines[0]);
        assertEquals(".".repeat(21), lines[20]);
    }

    @Test
    void recoveryPercentages()
    {
        assertEquals(7, RecoveryLevel.LOW.recoveryPercent());
        assertEquals(15, RecoveryLevel.MEDIUM.recoveryPercent());
        assertEquals(25, RecoveryLevel.HIGH.recoveryPercent());
        assertEquals(30, RecoveryLevel.HIGHEST.recoveryPercent());
    }
}
