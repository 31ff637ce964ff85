package com.questrail.qrcode.internal.reedsolomon;

/**
 * GaloisField256
 * -----------------------------------------------------------------------------
 * Arithmetic over GF(2^8) as used by QR Code Reed-Solomon coding.
 *
 * <p>Field parameters (ISO/IEC 18004 Section 7.5.2):</p>
 * <ul>
 *   <li>Primitive polynomial: x^8 + x^4 + x^3 + x^2 + 1 (0x11D)</li>
 *   <li>Generator element: alpha = 2</li>
 * </ul>
 *
 * <p>Elements are plain {@code int}s in {@code [0, 255]}. Multiplication and
 * division go through log/antilog tables built once at class
 * initialization; the tables are never written afterwards.</p>
 */
public final class GaloisField256
{
    public static final int ZERO = 0;
    public static final int ONE = 1;

    private static final int PRIMITIVE_POLY = 0x11D;

    /* exp[i] = alpha^i for i in [0, 255) */
    private static final int[] EXP = new int[255];

    /* log[alpha^i] = i; log[0] is undefined and never read */
    private static final int[] LOG = new int[256];

    static {
        int x = 1;
        for (int i = 0; i < 255; i++) {
            EXP[i] = x;
            LOG[x] = i;
            x <<= 1;
            if ((x & 0x100) != 0) {
                x ^= PRIMITIVE_POLY;
            }
        }
    }

    private GaloisField256() {}

    /**
     * Field addition (and subtraction): bitwise XOR.
     */
    public static int add(int a, int b)
    {
        return (a ^ b) & 0xFF;
    }

    /**
     * Returns alpha^power, with {@code power} taken modulo 255.
     */
    public static int exp(int power)
    {
        return EXP[Math.floorMod(power, 255)];
    }

    /**
     * Returns the discrete logarithm of {@code a}.
     *
     * @throws ArithmeticException if {@code a} is zero
     */
    public static int log(int a)
    {
        if (a == ZERO) {
            throw new ArithmeticException("log(0) is undefined in GF(256)");
        }
        return LOG[a];
    }

    public static int multiply(int a, int b)
    {
        if (a == ZERO || b == ZERO) {
            return ZERO;
        }
        return EXP[(LOG[a] + LOG[b]) % 255];
    }

    /**
     * Returns {@code a / b}.
     *
     * @throws ArithmeticException if {@code b} is zero
     */
    public static int divide(int a, int b)
    {
        if (b == ZERO) {
            throw new ArithmeticException("Division by zero in GF(256)");
        }
        if (a == ZERO) {
            return ZERO;
        }
        return EXP[(LOG[a] + 255 - LOG[b]) % 255];
    }

    /**
     * Returns the multiplicative inverse of {@code a}.
     *
     * @throws ArithmeticException if {@code a} is zero
     */
    public static int inverse(int a)
    {
        if (a == ZERO) {
            throw new ArithmeticException("Zero has no inverse in GF(256)");
        }
        return EXP[(255 - LOG[a]) % 255];
    }
}
