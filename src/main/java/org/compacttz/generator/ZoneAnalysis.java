package org.compacttz.generator;

import lombok.Value;
import org.compacttz.historical.HistoricalTransitionTable;
import org.compacttz.rules.CompactRuleSet;

/**
 * Generator output for one canonical zone.
 */
@Value
public class ZoneAnalysis {
    String name;
    CompactRuleSet rules;
    HistoricalTransitionTable table;
    /** Why the zone is always-historical, {@code null} when its compact rules apply. */
    String historicalReason;
}
