package org.compacttz.historical;

import org.compacttz.core.id.TimezoneId;

/**
 * Materializes the historical table of one zone.
 */
@FunctionalInterface
public interface TransitionTableLoader {

    /**
     * Loads a zone's table.
     *
     * @param zone canonical zone id.
     * @return decoded table.
     * @throws org.compacttz.data.CorruptEmbeddedDataException If the zone's data is invalid.
     */
    HistoricalTransitionTable load(TimezoneId zone);
}
