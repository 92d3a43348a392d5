package org.compacttz.generator;

import lombok.Value;
import org.compacttz.data.CompactRulesDocument;

import java.util.List;

/**
 * Complete generator output: the decoded document plus both serialized resources.
 */
@Value
public class GeneratedTzData {
    CompactRulesDocument document;
    byte[] compactRules;
    byte[] historical;
    /** Per-zone analyses in catalog order. */
    List<ZoneAnalysis> zones;

    /**
     * Returns number of zones routed entirely to historical tables.
     */
    public long alwaysHistoricalCount() {
        return zones.stream().filter(zone -> zone.getRules().isAlwaysHistorical()).count();
    }
}
