package com.questrail.qrcode.internal.version;

/**
 * A run of identically sized Reed-Solomon blocks within one QR Code version.
 *
 * @param numBlocks        number of blocks in this group
 * @param numCodewords     total codewords per block (data + error correction)
 * @param numDataCodewords data codewords per block
 */
public record BlockGroup(int numBlocks, int numCodewords, int numDataCodewords)
{
    public BlockGroup {
        if (numBlocks < 1) {
            throw new IllegalArgumentException("numBlocks must be positive");
        }
        if (numDataCodewords < 1 || numDataCodewords >= numCodewords) {
            throw new IllegalArgumentException(
                    "numDataCodewords must be in [1, numCodewords): " + numDataCodewords);
        }
    }

    /**
     * Returns the number of error correction codewords per block.
     */
    public int numErrorCodewords() {
        return numCodewords - numDataCodewords;
    }
}
