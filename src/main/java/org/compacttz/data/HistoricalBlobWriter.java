package org.compacttz.data;

import io.airlift.compress.zstd.ZstdCompressor;
import lombok.experimental.UtilityClass;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builds the historical container read by {@link HistoricalBlob}.
 */
@UtilityClass
public final class HistoricalBlobWriter {

    /**
     * Compresses each raw section independently and lays out header, index and sections.
     *
     * @param rawSections uncompressed transition payloads in catalog order.
     * @return container bytes.
     */
    public static byte[] write(List<byte[]> rawSections) {
        Objects.requireNonNull(rawSections, "rawSections");
        int zoneCount = rawSections.size();
        if (zoneCount > 0xFFFF) {
            throw new IllegalArgumentException("too many zones for the container: " + zoneCount);
        }

        ZstdCompressor compressor = new ZstdCompressor();
        byte[][] compressed = new byte[zoneCount][];
        for (int i = 0; i < zoneCount; i++) {
            compressed[i] = compress(compressor, Objects.requireNonNull(rawSections.get(i), "rawSections[" + i + "]"));
        }

        int indexEnd = HistoricalBlob.HEADER_BYTES + zoneCount * HistoricalBlob.INDEX_ENTRY_BYTES;
        ByteBuffer head = ByteBuffer.allocate(indexEnd).order(ByteOrder.LITTLE_ENDIAN);
        head.putInt(HistoricalBlob.MAGIC);
        head.putShort((short) HistoricalBlob.VERSION);
        head.putShort((short) zoneCount);
        int dataOffset = indexEnd;
        for (byte[] section : compressed) {
            head.putInt(dataOffset);
            head.putInt(section.length);
            dataOffset += section.length;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(dataOffset);
        out.write(head.array(), 0, indexEnd);
        for (byte[] section : compressed) {
            out.write(section, 0, section.length);
        }
        return out.toByteArray();
    }

    private static byte[] compress(ZstdCompressor compressor, byte[] raw) {
        byte[] buffer = new byte[compressor.maxCompressedLength(raw.length)];
        int written = compressor.compress(raw, 0, raw.length, buffer, 0, buffer.length);
        return Arrays.copyOf(buffer, written);
    }
}
