package org.compacttz.historical;

import org.compacttz.core.id.TimezoneId;

import java.util.Objects;

/**
 * Lazily populated historical tables, one per canonical zone.
 *
 * <p>A zone's table is decoded on its first lookup and stays resident for the life of the
 * store.</p>
 */
public final class HistoricalTransitionStore {
    private final LoadOnceCache<HistoricalTransitionTable> tables;
    private final TransitionTableLoader loader;

    /**
     * Creates an empty store.
     *
     * @param zoneCount catalog size.
     * @param loader table loader invoked at most once per zone.
     */
    public HistoricalTransitionStore(int zoneCount, TransitionTableLoader loader) {
        this.tables = new LoadOnceCache<>(zoneCount);
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Returns the historical offset of a zone at an instant.
     *
     * @param zone canonical zone id.
     * @param epochSeconds Unix timestamp in seconds.
     * @return offset in minutes east of UTC.
     * @throws org.compacttz.data.CorruptEmbeddedDataException If the zone's data is invalid.
     */
    public int lookup(TimezoneId zone, long epochSeconds) {
        return table(zone).offsetAt(epochSeconds);
    }

    /**
     * Returns a zone's table, loading it on first use.
     */
    public HistoricalTransitionTable table(TimezoneId zone) {
        Objects.requireNonNull(zone, "zone");
        int index = zone.getIndex();
        if (index < 0 || index >= tables.capacity()) {
            throw new IndexOutOfBoundsException("Catalog index out of bounds: " + index);
        }
        return tables.get(index, i -> loader.load(zone));
    }

    /**
     * Returns {@code true} when the zone's table is resident.
     */
    public boolean isResident(TimezoneId zone) {
        Objects.requireNonNull(zone, "zone");
        return tables.isLoaded(zone.getIndex());
    }

    /**
     * Returns number of resident tables.
     */
    public int residentCount() {
        return tables.loadedCount();
    }
}
