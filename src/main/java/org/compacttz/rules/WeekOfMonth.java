package org.compacttz.rules;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Which occurrence of a weekday inside a month a transition rule selects.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum WeekOfMonth {
    FIRST(1),
    SECOND(2),
    THIRD(3),
    FOURTH(4),
    /** Last occurrence; the 4th or 5th depending on the month. */
    LAST(5);

    /** Stable wire code stored in the compact rule table. */
    private final int code;

    /**
     * Maps a wire code back to its enum value.
     *
     * @param code value in range {@code [1, 5]}.
     * @return matching week-of-month.
     */
    public static WeekOfMonth fromCode(int code) {
        for (WeekOfMonth week : values()) {
            if (week.code == code) {
                return week;
            }
        }
        throw new IllegalArgumentException("Unsupported week-of-month code: " + code);
    }
}
