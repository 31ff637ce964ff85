package com.questrail.qrcode.core;

import com.questrail.qrcode.api.ContentTooLongException;
import com.questrail.qrcode.api.QrMatrix;
import com.questrail.qrcode.api.RecoveryLevel;
import com.questrail.qrcode.config.QrEncoderConfig;
import com.questrail.qrcode.internal.bits.BitVector;
import com.questrail.qrcode.internal.reedsolomon.ReedSolomonEncoder;
import com.questrail.qrcode.internal.segment.DataEncoder;
import com.questrail.qrcode.internal.segment.DataEncoderType;
import com.questrail.qrcode.internal.symbol.MaskPattern;
import com.questrail.qrcode.internal.symbol.PenaltyScorer;
import com.questrail.qrcode.internal.symbol.RegularSymbolBuilder;
import com.questrail.qrcode.internal.symbol.Symbol;
import com.questrail.qrcode.internal.version.BlockGroup;
import com.questrail.qrcode.internal.version.QrVersion;
import com.questrail.qrcode.internal.version.QrVersionTable;
import com.questrail.qrcode.observability.BracketRejectedEvent;
import com.questrail.qrcode.observability.MaskEvaluatedEvent;
import com.questrail.qrcode.observability.MaskSelectedEvent;
import com.questrail.qrcode.observability.QrEncodingObservabilitySink;
import com.questrail.qrcode.observability.VersionSelectedEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * QrCode
 * ============================================================================
 * One piece of content encoded as a QR Code of a fixed version and level.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   byte[] content
 *     → DataEncoder          (segments, tried per version bracket)
 *     → QrVersionTable       (smallest fitting version)
 *     → terminator + padding
 *     → ReedSolomonEncoder   (per block) + interleaving
 *     → RegularSymbolBuilder (x8 masks) → PenaltyScorer
 *     → QrMatrix
 * </pre>
 *
 * <p>Creation runs the first two steps, so capacity errors surface early.
 * The remaining steps run on the first call to {@link #matrix()} and the
 * result is kept.</p>
 */
public final class QrCode
{
    private static final int NUM_MASKS = 8;

    /* 0b11101100 and 0b00010001, inserted alternately */
    private static final int[] PAD_CODEWORDS = {0xEC, 0x11};

    private final RecoveryLevel level;
    private final QrVersion version;
    private final DataEncoderType encoderType;
    private final BitVector encoded;
    private final boolean includeQuietZone;
    private final QrEncodingObservabilitySink sink;

    private QrMatrix matrix;

    private QrCode(RecoveryLevel level,
                   QrVersion version,
                   DataEncoderType encoderType,
                   BitVector encoded,
                   QrEncoderConfig config)
    {
        this.level = level;
        this.version = version;
        this.encoderType = encoderType;
        this.encoded = encoded;
        this.includeQuietZone = config.includeQuietZone();
        this.sink = config.observabilitySink();
    }

    /**
     * Encodes {@code content} and chooses the smallest version able to hold it.
     *
     * <p>Brackets are tried from the smallest versions upwards; a bracket is
     * skipped if a segment overflows its count fields or if even its largest
     * version is too small.</p>
     *
     * @throws ContentTooLongException if no bracket can hold the content
     */
    public static QrCode create(byte[] content, RecoveryLevel level, QrEncoderConfig config)
            throws ContentTooLongException
    {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(config, "config");

        final QrEncodingObservabilitySink sink = config.observabilitySink();

        for (DataEncoderType type : DataEncoderType.values()) {
            DataEncoder encoder = new DataEncoder(type);

            Optional<BitVector> encoded = encoder.encode(content);
            if (encoded.isEmpty()) {
                sink.onBracketRejected(new BracketRejectedEvent(type.minVersion(), type.maxVersion(),
                        level, content.length, BracketRejectedEvent.Reason.COUNT_FIELD_OVERFLOW));
                continue;
            }

            final int numBits = encoded.get().length();
            Optional<QrVersion> chosen = QrVersionTable.choose(level, type, numBits);
            if (chosen.isEmpty()) {
                sink.onBracketRejected(new BracketRejectedEvent(type.minVersion(), type.maxVersion(),
                        level, content.length, BracketRejectedEvent.Reason.CAPACITY_EXCEEDED));
                continue;
            }

            QrVersion version = chosen.get();
            sink.onVersionSelected(new VersionSelectedEvent(
                    version.version(), level, numBits, version.numDataBits()));
            return new QrCode(level, version, type, encoded.get(), config);
        }

        throw new ContentTooLongException(content.length, level);
    }

    public RecoveryLevel level()
    {
        return level;
    }

    /**
     * Returns the chosen QR Code version number (1-40).
     */
    public int versionNumber()
    {
        return version.version();
    }

    /**
     * Returns the version bracket whose data encoder produced the bitstream.
     */
    public DataEncoderType encoderType()
    {
        return encoderType;
    }

    /**
     * Returns the finished symbol, building it on first use.
     */
    public synchronized QrMatrix matrix()
    {
        if (matrix == null) {
            matrix = build();
        }
        return matrix;
    }

    private QrMatrix build()
    {
        final BitVector data = encoded.copy();
        data.appendRepeated(version.numTerminatorBitsRequired(data.length()), false);
        addPadding(data);

        final BitVector codewords = encodeBlocks(data);

        Symbol best = null;
        int bestMask = -1;
        int bestPenalty = 0;

        // All masks are scored; ties keep the lower id
        for (int id = 0; id < NUM_MASKS; id++) {
            Symbol s = RegularSymbolBuilder.build(version, MaskPattern.fromId(id), codewords, includeQuietZone);

            int numEmptyModules = s.numEmptyModules();
            if (numEmptyModules != 0) {
                throw new IllegalStateException(String.format(
                        "%d modules left unwritten (version=%s, mask=%d)", numEmptyModules, version, id));
            }

            int penalty = PenaltyScorer.score(s);
            sink.onMaskEvaluated(new MaskEvaluatedEvent(version.version(), id, penalty));

            if (best == null || penalty < bestPenalty) {
                best = s;
                bestMask = id;
                bestPenalty = penalty;
            }
        }

        sink.onMaskSelected(new MaskSelectedEvent(version.version(), level, bestMask, bestPenalty));
        return new QrMatrix(best.bitmap(), version.version(), level, bestMask, best.quietZoneSize());
    }

    /**
     * Pads {@code data} to the full data capacity: zeros up to the next
     * codeword boundary, then alternating pad codewords.
     */
    private void addPadding(BitVector data)
    {
        final int numDataBits = version.numDataBits();
        if (data.length() == numDataBits) {
            return;
        }

        data.appendRepeated(version.numBitsToPadToCodeword(data.length()), false);

        int i = 0;
        while (numDataBits - data.length() >= 8) {
            data.appendByte(PAD_CODEWORDS[i], 8);
            i = 1 - i;
        }

        if (data.length() != numDataBits) {
            throw new IllegalStateException(String.format(
                    "Padded data is %d bits, expected %d (version=%s)", data.length(), numDataBits, version));
        }
    }

    /**
     * Splits {@code data} into the version's blocks, appends error correction
     * to each, and interleaves the result: data codewords block by block, then
     * error correction codewords block by block, then the remainder bits.
     */
    private BitVector encodeBlocks(BitVector data)
    {
        final BitVector[] blocks = new BitVector[version.numBlocks()];
        final int[] ecStartOffsets = new int[blocks.length];

        int start = 0;
        int blockId = 0;
        for (BlockGroup g : version.blockGroups()) {
            for (int j = 0; j < g.numBlocks(); j++) {
                int end = start + g.numDataCodewords() * 8;
                blocks[blockId] = ReedSolomonEncoder.encode(data.substring(start, end), g.numErrorCodewords());
                ecStartOffsets[blockId] = end - start;
                start = end;
                blockId++;
            }
        }

        final BitVector result = new BitVector();

        // Data codewords
        boolean working = true;
        for (int i = 0; working; i += 8) {
            working = false;
            for (int b = 0; b < blocks.length; b++) {
                if (i >= ecStartOffsets[b]) {
                    continue;
                }
                result.append(blocks[b].substring(i, i + 8));
                working = true;
            }
        }

        // Error correction codewords
        working = true;
        for (int i = 0; working; i += 8) {
            working = false;
            for (int b = 0; b < blocks.length; b++) {
                int offset = i + ecStartOffsets[b];
                if (offset >= blocks[b].length()) {
                    continue;
                }
                result.append(blocks[b].substring(offset, offset + 8));
                working = true;
            }
        }

        result.appendRepeated(version.remainderBits(), false);
        return result;
    }
}
