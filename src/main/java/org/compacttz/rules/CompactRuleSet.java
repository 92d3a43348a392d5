package org.compacttz.rules;

import lombok.Value;

import java.util.Optional;

/**
 * Always-resident offset rules for one canonical zone.
 */
@Value
public class CompactRuleSet {
    /** Sentinel {@link #rulesValidFrom} for zones whose rules never changed. */
    public static final long VALID_SINCE_FOREVER = Long.MIN_VALUE;

    /** Base UTC offset outside DST, in minutes east of UTC. */
    int standardOffsetMinutes;
    /** DST schedule, {@code null} for zones without DST. */
    DstRule dstRule;
    /** Compact rules apply only to instants at or after this Unix second. */
    long rulesValidFrom;
    /** Zones whose offset cannot follow a fixed rule route every query to the historical table. */
    boolean alwaysHistorical;

    /**
     * Returns the DST schedule when the zone observes DST.
     */
    public Optional<DstRule> dst() {
        return Optional.ofNullable(dstRule);
    }

    /**
     * Returns {@code true} when the compact rules cover the instant.
     *
     * @param epochSeconds Unix timestamp in seconds.
     */
    public boolean covers(long epochSeconds) {
        return !alwaysHistorical && epochSeconds >= rulesValidFrom;
    }

    /**
     * Creates a rule set for a zone with a fixed offset.
     */
    public static CompactRuleSet fixed(int offsetMinutes, long rulesValidFrom) {
        return new CompactRuleSet(offsetMinutes, null, rulesValidFrom, false);
    }
}
