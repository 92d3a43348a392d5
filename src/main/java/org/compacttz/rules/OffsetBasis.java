package org.compacttz.rules;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Offset in which a transition rule's local time of day is expressed.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum OffsetBasis {
    /** Local time is read on the zone's standard offset. */
    STANDARD(0),
    /** Local time is read on standard offset plus the DST delta. */
    DAYLIGHT(1);

    /** Stable wire code stored in the compact rule table. */
    private final int code;

    /**
     * Resolves the basis offset in minutes.
     *
     * @param standardOffsetMinutes zone standard offset.
     * @param dstDeltaMinutes DST delta.
     * @return offset used to convert the rule's local time to UTC.
     */
    public int offsetMinutes(int standardOffsetMinutes, int dstDeltaMinutes) {
        return this == STANDARD ? standardOffsetMinutes : standardOffsetMinutes + dstDeltaMinutes;
    }

    /**
     * Maps a wire code back to its enum value.
     */
    public static OffsetBasis fromCode(int code) {
        for (OffsetBasis basis : values()) {
            if (basis.code == code) {
                return basis;
            }
        }
        throw new IllegalArgumentException("Unsupported offset basis code: " + code);
    }
}
