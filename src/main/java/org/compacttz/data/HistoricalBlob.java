package org.compacttz.data;

import org.compacttz.core.id.TimezoneId;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * Read view over the historical container.
 *
 * <p>Layout (little-endian):</p>
 * <pre>
 * magic u32 ("CTZH") | version u16 | zoneCount u16
 * index[zoneCount]   : dataOffset u32 | compressedLength u32
 * sections           : one zstd frame per zone, in catalog order
 * </pre>
 */
public final class HistoricalBlob implements TzDataSource {
    public static final int MAGIC = 0x485A5443; // "CTZH" in little-endian
    public static final int VERSION = 1;
    static final int HEADER_BYTES = 8;
    static final int INDEX_ENTRY_BYTES = 8;

    private final byte[] bytes;
    private final int zoneCount;
    private final int[] sectionOffsets;
    private final int[] sectionLengths;

    private HistoricalBlob(byte[] bytes, int zoneCount, int[] sectionOffsets, int[] sectionLengths) {
        this.bytes = bytes;
        this.zoneCount = zoneCount;
        this.sectionOffsets = sectionOffsets;
        this.sectionLengths = sectionLengths;
    }

    /**
     * Parses and bounds-checks the container header and index.
     *
     * @param bytes container bytes; retained without copying.
     * @param expectedZoneCount catalog size the container must match.
     * @return validated container view.
     * @throws CorruptEmbeddedDataException If the header or index is invalid.
     */
    public static HistoricalBlob parse(byte[] bytes, int expectedZoneCount) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length < HEADER_BYTES) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_BAD_MAGIC,
                    "historical container truncated at " + bytes.length + " bytes"
            );
        }
        ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int magic = bb.getInt(0);
        if (magic != MAGIC) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_BAD_MAGIC,
                    "historical container magic mismatch: 0x" + Integer.toHexString(magic)
            );
        }
        int version = Short.toUnsignedInt(bb.getShort(4));
        if (version != VERSION) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_UNSUPPORTED_VERSION,
                    "historical container version " + version + " is not supported"
            );
        }
        int zoneCount = Short.toUnsignedInt(bb.getShort(6));
        if (zoneCount != expectedZoneCount) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_ZONE_COUNT_MISMATCH,
                    "historical container holds " + zoneCount + " zones, catalog holds " + expectedZoneCount
            );
        }
        long indexEnd = HEADER_BYTES + (long) zoneCount * INDEX_ENTRY_BYTES;
        if (indexEnd > bytes.length) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_INDEX_OUT_OF_BOUNDS,
                    "historical index exceeds container size"
            );
        }

        int[] offsets = new int[zoneCount];
        int[] lengths = new int[zoneCount];
        for (int i = 0; i < zoneCount; i++) {
            int entry = HEADER_BYTES + i * INDEX_ENTRY_BYTES;
            long offset = Integer.toUnsignedLong(bb.getInt(entry));
            long length = Integer.toUnsignedLong(bb.getInt(entry + 4));
            if (offset < indexEnd || offset + length > bytes.length) {
                throw new CorruptEmbeddedDataException(
                        CorruptEmbeddedDataException.REASON_INDEX_OUT_OF_BOUNDS,
                        "historical section " + i + " [" + offset + ", +" + length + ") outside container"
                );
            }
            offsets[i] = (int) offset;
            lengths[i] = (int) length;
        }
        return new HistoricalBlob(bytes, zoneCount, offsets, lengths);
    }

    @Override
    public byte[] compressedBytesFor(TimezoneId zone) {
        Objects.requireNonNull(zone, "zone");
        int index = zone.getIndex();
        if (index < 0 || index >= zoneCount) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_INDEX_OUT_OF_BOUNDS,
                    "no historical section for " + zone.getName() + " (index " + index + ")"
            );
        }
        int offset = sectionOffsets[index];
        return Arrays.copyOfRange(bytes, offset, offset + sectionLengths[index]);
    }

    /**
     * Returns number of zone sections.
     */
    public int zoneCount() {
        return zoneCount;
    }

    /**
     * Returns total container size in bytes.
     */
    public int sizeBytes() {
        return bytes.length;
    }
}
