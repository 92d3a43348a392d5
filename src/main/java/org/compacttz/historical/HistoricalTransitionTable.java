package org.compacttz.historical;

import org.compacttz.data.CorruptEmbeddedDataException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable ordered list of (instant, offset) entries for one zone.
 *
 * <p>Each entry states the offset in force from its instant until the next entry's instant.
 * Instants before the first entry take the first entry's offset.</p>
 */
public final class HistoricalTransitionTable {
    /** Bytes per serialized entry: i64 instant + i16 offset, little-endian. */
    public static final int ENTRY_BYTES = 10;

    private final long[] instants;
    private final short[] offsets;

    private HistoricalTransitionTable(long[] instants, short[] offsets) {
        this.instants = instants;
        this.offsets = offsets;
    }

    /**
     * Creates a table from parallel arrays.
     *
     * @param instants strictly ascending Unix seconds.
     * @param offsetMinutes offsets in minutes, one per instant.
     * @return validated table.
     * @throws CorruptEmbeddedDataException If the arrays are empty or unordered.
     */
    public static HistoricalTransitionTable of(long[] instants, short[] offsetMinutes) {
        Objects.requireNonNull(instants, "instants");
        Objects.requireNonNull(offsetMinutes, "offsetMinutes");
        if (instants.length != offsetMinutes.length) {
            throw new IllegalArgumentException("instants and offsets must have equal length");
        }
        long[] copyInstants = Arrays.copyOf(instants, instants.length);
        short[] copyOffsets = Arrays.copyOf(offsetMinutes, offsetMinutes.length);
        validate(copyInstants);
        return new HistoricalTransitionTable(copyInstants, copyOffsets);
    }

    /**
     * Decodes the raw little-endian payload of a historical section.
     *
     * @param raw decompressed section bytes.
     * @return validated table.
     * @throws CorruptEmbeddedDataException If the payload is empty, misaligned or unordered.
     */
    public static HistoricalTransitionTable fromBytes(byte[] raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw.length % ENTRY_BYTES != 0) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_LENGTH_MISMATCH,
                    "historical payload length " + raw.length + " is not a multiple of " + ENTRY_BYTES
            );
        }
        int count = raw.length / ENTRY_BYTES;
        long[] instants = new long[count];
        short[] offsets = new short[count];
        ByteBuffer bb = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < count; i++) {
            instants[i] = bb.getLong();
            offsets[i] = bb.getShort();
        }
        validate(instants);
        return new HistoricalTransitionTable(instants, offsets);
    }

    /**
     * Encodes the table into the raw section payload.
     */
    public byte[] toBytes() {
        ByteBuffer bb = ByteBuffer.allocate(instants.length * ENTRY_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < instants.length; i++) {
            bb.putLong(instants[i]);
            bb.putShort(offsets[i]);
        }
        return bb.array();
    }

    /**
     * Returns the offset in force at an instant.
     *
     * @param epochSeconds Unix timestamp in seconds.
     * @return offset in minutes east of UTC.
     */
    public int offsetAt(long epochSeconds) {
        int pos = Arrays.binarySearch(instants, epochSeconds);
        if (pos >= 0) {
            return offsets[pos];
        }
        int insertion = -pos - 1;
        // Before the first entry: floor to the earliest known offset.
        return insertion == 0 ? offsets[0] : offsets[insertion - 1];
    }

    /**
     * Returns number of entries.
     */
    public int size() {
        return instants.length;
    }

    /**
     * Returns the instant of entry {@code i}.
     */
    public long instantAt(int i) {
        return instants[i];
    }

    /**
     * Returns the offset of entry {@code i} in minutes.
     */
    public int offsetMinutesAt(int i) {
        return offsets[i];
    }

    /**
     * Returns the first covered instant.
     */
    public long firstInstant() {
        return instants[0];
    }

    /**
     * Returns the last entry's instant.
     */
    public long lastInstant() {
        return instants[instants.length - 1];
    }

    private static void validate(long[] instants) {
        if (instants.length == 0) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_EMPTY_TABLE,
                    "historical table has no entries"
            );
        }
        for (int i = 1; i < instants.length; i++) {
            if (instants[i] <= instants[i - 1]) {
                throw new CorruptEmbeddedDataException(
                        CorruptEmbeddedDataException.REASON_UNORDERED_TRANSITIONS,
                        "historical instants not strictly ascending at entry " + i
                );
            }
        }
    }
}
