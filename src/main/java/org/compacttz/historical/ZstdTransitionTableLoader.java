package org.compacttz.historical;

import io.airlift.compress.MalformedInputException;
import io.airlift.compress.zstd.ZstdDecompressor;
import org.compacttz.core.id.TimezoneId;
import org.compacttz.data.CorruptEmbeddedDataException;
import org.compacttz.data.TzDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Loads tables by decompressing a zone's zstd section from a {@link TzDataSource}.
 */
public final class ZstdTransitionTableLoader implements TransitionTableLoader {
    private static final Logger log = LoggerFactory.getLogger(ZstdTransitionTableLoader.class);

    private final TzDataSource source;
    private final int maxDecompressedBytes;

    /**
     * Creates a loader.
     *
     * @param source compressed section supplier.
     * @param maxDecompressedBytes upper bound for one decompressed table.
     */
    public ZstdTransitionTableLoader(TzDataSource source, int maxDecompressedBytes) {
        this.source = Objects.requireNonNull(source, "source");
        if (maxDecompressedBytes <= 0) {
            throw new IllegalArgumentException("maxDecompressedBytes must be > 0");
        }
        this.maxDecompressedBytes = maxDecompressedBytes;
    }

    @Override
    public HistoricalTransitionTable load(TimezoneId zone) {
        Objects.requireNonNull(zone, "zone");
        byte[] compressed = source.compressedBytesFor(zone);
        try {
            HistoricalTransitionTable table = HistoricalTransitionTable.fromBytes(decompress(zone, compressed));
            log.debug("Loaded historical table for {}: {} entries from {} compressed bytes",
                    zone.getName(), table.size(), compressed.length);
            return table;
        } catch (CorruptEmbeddedDataException ex) {
            log.error("Historical data for {} is corrupt: {}", zone.getName(), ex.getMessage());
            throw ex;
        }
    }

    private byte[] decompress(TimezoneId zone, byte[] compressed) {
        try {
            long declared = ZstdDecompressor.getDecompressedSize(compressed, 0, compressed.length);
            if (declared > maxDecompressedBytes) {
                throw new CorruptEmbeddedDataException(
                        CorruptEmbeddedDataException.REASON_LENGTH_MISMATCH,
                        "section of " + zone.getName() + " declares " + declared + " bytes, limit " + maxDecompressedBytes
                );
            }
            // -1 means the frame header carries no content size.
            int capacity = declared >= 0 ? (int) declared : maxDecompressedBytes;
            byte[] output = new byte[capacity];
            int written = new ZstdDecompressor().decompress(compressed, 0, compressed.length, output, 0, output.length);
            if (declared >= 0 && written != declared) {
                throw new CorruptEmbeddedDataException(
                        CorruptEmbeddedDataException.REASON_LENGTH_MISMATCH,
                        "section of " + zone.getName() + " decompressed to " + written + " bytes, header says " + declared
                );
            }
            return written == output.length ? output : Arrays.copyOf(output, written);
        } catch (MalformedInputException ex) {
            throw decompressionFailed(zone, ex);
        } catch (CorruptEmbeddedDataException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            // Truncated frames can surface as bounds failures instead of MalformedInputException.
            throw decompressionFailed(zone, ex);
        }
    }

    private static CorruptEmbeddedDataException decompressionFailed(TimezoneId zone, RuntimeException cause) {
        return new CorruptEmbeddedDataException(
                CorruptEmbeddedDataException.REASON_DECOMPRESSION_FAILED,
                "section of " + zone.getName() + " is not a valid zstd frame: " + cause.getMessage(),
                cause
        );
    }
}
