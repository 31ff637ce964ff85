package com.questrail.qrcode.internal.reedsolomon;

import com.questrail.qrcode.internal.bits.BitVector;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ReedSolomonEncoder
 * -----------------------------------------------------------------------------
 * Systematic Reed-Solomon encoder for QR Code data blocks.
 *
 * <p>The output is the unmodified input followed by the error correction
 * codewords. The number of error correction codewords per block is given by
 * the version/level capacity table (ISO/IEC 18004 Table 9), e.g. 7 for 1-L.</p>
 *
 * <pre>
 *   data(x) * x^n  mod  g(x),   g(x) = (x + a^0)(x + a^1)...(x + a^(n-1))
 * </pre>
 */
public final class ReedSolomonEncoder
{
    private static final Map<Integer, GfPolynomial> GENERATORS = new ConcurrentHashMap<>();

    private ReedSolomonEncoder() {}

    /**
     * Appends {@code numEcBytes} error correction codewords to {@code data}.
     *
     * <p>The data bits are copied as-is rather than re-derived from the
     * polynomial form: {@code data * x^n + remainder} would be the textbook
     * codeword, but normalization would drop leading zero bytes.</p>
     *
     * @param data       block data; its length must be a multiple of 8
     * @param numEcBytes number of error correction codewords, at least 2
     * @return a new vector holding data followed by the error correction codewords
     */
    public static BitVector encode(BitVector data, int numEcBytes)
    {
        Objects.requireNonNull(data, "data");
        if (data.length() % 8 != 0) {
            throw new IllegalArgumentException(
                    "Block length must be a whole number of codewords: " + data.length() + " bits");
        }

        GfPolynomial message = GfPolynomial.fromData(data)
                .multiply(GfPolynomial.monomial(GaloisField256.ONE, numEcBytes));
        GfPolynomial remainder = message.remainder(generator(numEcBytes));

        return data.copy().appendBytes(remainder.toBytes(numEcBytes));
    }

    /**
     * Returns the generator polynomial of the given degree.
     *
     * @throws IllegalArgumentException if {@code degree < 2}
     */
    static GfPolynomial generator(int degree)
    {
        if (degree < 2) {
            throw new IllegalArgumentException("Generator degree must be at least 2: " + degree);
        }
        return GENERATORS.computeIfAbsent(degree, ReedSolomonEncoder::buildGenerator);
    }

    private static GfPolynomial buildGenerator(int degree)
    {
        GfPolynomial generator = GfPolynomial.of(GaloisField256.ONE);
        for (int i = 0; i < degree; i++) {
            generator = generator.multiply(GfPolynomial.of(GaloisField256.exp(i), GaloisField256.ONE));
        }
        return generator;
    }
}
