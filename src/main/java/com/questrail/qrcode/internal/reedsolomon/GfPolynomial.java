package com.questrail.qrcode.internal.reedsolomon;

import com.questrail.qrcode.internal.bits.BitVector;

import java.util.Arrays;
import java.util.Objects;

/**
 * GfPolynomial
 * -----------------------------------------------------------------------------
 * Immutable polynomial with coefficients in GF(2^8).
 *
 * <p>The coefficient at index {@code i} belongs to {@code x^i}:</p>
 * <pre>
 *   terms[0]*x^0 + terms[1]*x^1 + ... + terms[n-1]*x^(n-1)
 * </pre>
 *
 * <p>Instances are always normalized: the highest stored term is non-zero.
 * The zero polynomial has no terms and degree {@code -1}.</p>
 */
public final class GfPolynomial
{
    public static final GfPolynomial ZERO = new GfPolynomial(new int[0]);

    private final int[] terms;

    private GfPolynomial(int[] terms)
    {
        this.terms = terms;
    }

    /**
     * Creates a polynomial from coefficients in ascending degree order.
     * Trailing zero coefficients are dropped.
     */
    public static GfPolynomial of(int... terms)
    {
        Objects.requireNonNull(terms, "terms");
        for (int t : terms) {
            if (t < 0 || t > 255) {
                throw new IllegalArgumentException("Coefficient out of range: " + t);
            }
        }
        return normalized(terms.clone());
    }

    /**
     * Returns {@code coefficient * x^degree}.
     */
    public static GfPolynomial monomial(int coefficient, int degree)
    {
        if (degree < 0) {
            throw new IllegalArgumentException("degree must be non-negative");
        }
        if (coefficient == GaloisField256.ZERO) {
            return ZERO;
        }
        int[] terms = new int[degree + 1];
        terms[degree] = coefficient;
        return new GfPolynomial(terms);
    }

    /**
     * Interprets the bytes of {@code data} as coefficients, first byte highest.
     *
     * <p>For an n-byte input the polynomial is
     * {@code data[0]*x^(n-1) + data[1]*x^(n-2) + ... + data[n-1]*x^0}.</p>
     */
    public static GfPolynomial fromData(BitVector data)
    {
        Objects.requireNonNull(data, "data");
        int numBytes = (data.length() + 7) / 8;
        int[] terms = new int[numBytes];

        int i = numBytes - 1;
        for (int j = 0; j < data.length(); j += 8) {
            terms[i--] = data.byteAt(j);
        }
        return normalized(terms);
    }

    /**
     * Returns the number of stored terms (degree + 1).
     */
    public int numTerms()
    {
        return terms.length;
    }

    public int degree()
    {
        return terms.length - 1;
    }

    public boolean isZero()
    {
        return terms.length == 0;
    }

    /**
     * Returns the coefficient of {@code x^power}, zero above the degree.
     */
    public int coefficient(int power)
    {
        if (power < 0) {
            throw new IllegalArgumentException("power must be non-negative");
        }
        return power < terms.length ? terms[power] : GaloisField256.ZERO;
    }

    /**
     * Returns {@code this + other}.
     */
    public GfPolynomial add(GfPolynomial other)
    {
        Objects.requireNonNull(other, "other");
        int[] result = new int[Math.max(terms.length, other.terms.length)];
        for (int i = 0; i < result.length; i++) {
            result[i] = GaloisField256.add(coefficient(i), other.coefficient(i));
        }
        return normalized(result);
    }

    /**
     * Returns {@code this * other}.
     */
    public GfPolynomial multiply(GfPolynomial other)
    {
        Objects.requireNonNull(other, "other");
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        int[] result = new int[terms.length + other.terms.length - 1];
        for (int i = 0; i < terms.length; i++) {
            if (terms[i] == GaloisField256.ZERO) {
                continue;
            }
            for (int j = 0; j < other.terms.length; j++) {
                result[i + j] ^= GaloisField256.multiply(terms[i], other.terms[j]);
            }
        }
        return normalized(result);
    }

    /**
     * Returns the remainder of {@code this / denominator}.
     *
     * <p>Each step cancels the leading term of the running remainder, so the
     * degree strictly decreases until it is below the denominator's.</p>
     *
     * @throws ArithmeticException if {@code denominator} is the zero polynomial
     */
    public GfPolynomial remainder(GfPolynomial denominator)
    {
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.isZero()) {
            throw new ArithmeticException("Polynomial remainder by zero");
        }

        final int leading = denominator.terms[denominator.terms.length - 1];

        GfPolynomial remainder = this;
        while (remainder.numTerms() >= denominator.numTerms()) {
            int shift = remainder.numTerms() - denominator.numTerms();
            int coefficient = GaloisField256.divide(
                    remainder.terms[remainder.terms.length - 1], leading);
            GfPolynomial subtrahend = denominator.multiply(monomial(coefficient, shift));
            remainder = remainder.add(subtrahend);
        }
        return remainder;
    }

    /**
     * Returns the {@code numBytes} lowest coefficients as bytes, highest degree
     * first. Missing high terms are written as zero bytes.
     *
     * @throws IllegalArgumentException if the polynomial has more terms than fit
     */
    public byte[] toBytes(int numBytes)
    {
        if (numBytes < terms.length) {
            throw new IllegalArgumentException(
                    "Polynomial with " + terms.length + " terms does not fit in " + numBytes + " bytes");
        }
        byte[] result = new byte[numBytes];
        int i = numBytes - terms.length;
        for (int j = terms.length - 1; j >= 0; j--) {
            result[i++] = (byte) terms[j];
        }
        return result;
    }

    private static GfPolynomial normalized(int[] terms)
    {
        int n = terms.length;
        while (n > 0 && terms[n - 1] == GaloisField256.ZERO) {
            n--;
        }
        if (n == 0) {
            return ZERO;
        }
        return new GfPolynomial(n == terms.length ? terms : Arrays.copyOf(terms, n));
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GfPolynomial other)) {
            return false;
        }
        return Arrays.equals(terms, other.terms);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(terms);
    }

    /**
     * Renders the polynomial highest degree first, e.g. {@code "1x^2 + 9x^0"}.
     */
    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        for (int i = terms.length - 1; i >= 0; i--) {
            if (terms[i] == GaloisField256.ZERO) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append(terms[i]).append("x^").append(i);
        }
        return sb.length() == 0 ? "0" : sb.toString();
    }
}
