package org.compacttz.rules;

import lombok.Value;

import java.util.Objects;

/**
 * Recurring daylight-saving schedule: a start rule, an end rule and the offset added in between.
 */
@Value
public class DstRule {
    /** Offset added to standard time while DST is active, typically {@code 60}. */
    int dstOffsetDeltaMinutes;
    TransitionRule startRule;
    TransitionRule endRule;

    /**
     * Creates a DST schedule.
     */
    public DstRule(int dstOffsetDeltaMinutes, TransitionRule startRule, TransitionRule endRule) {
        if (dstOffsetDeltaMinutes == 0) {
            throw new IllegalArgumentException("dstOffsetDeltaMinutes must be non-zero");
        }
        this.dstOffsetDeltaMinutes = dstOffsetDeltaMinutes;
        this.startRule = Objects.requireNonNull(startRule, "startRule");
        this.endRule = Objects.requireNonNull(endRule, "endRule");
    }

    /**
     * Returns {@code true} when DST starts in a later month than it ends, so the DST period
     * wraps the year boundary (southern-hemisphere pattern).
     */
    public boolean spansYearBoundary() {
        return startRule.getMonth() > endRule.getMonth();
    }
}
