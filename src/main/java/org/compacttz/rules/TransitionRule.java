package org.compacttz.rules;

import lombok.Value;

import java.util.Objects;

/**
 * Symbolic DST boundary such as "second Sunday of March at 02:00 standard time".
 */
@Value
public class TransitionRule {
    private static final String[] WEEKDAY_NAMES = {"Sun", "Mon", "Tue", "Wed", "Thu", "Fri", "Sat"};

    /** Month in range {@code [1, 12]}. */
    int month;
    WeekOfMonth week;
    /** Day of week where Sunday = 0 and Saturday = 6. */
    int weekday;
    /**
     * Local time of day in minutes from midnight. May fall outside {@code [0, 1440)} when a
     * rule was rebased from another time definition; the excess rolls into the adjacent day.
     */
    int localTimeMinutes;
    OffsetBasis basis;

    /**
     * Creates a validated transition rule.
     */
    public TransitionRule(int month, WeekOfMonth week, int weekday, int localTimeMinutes, OffsetBasis basis) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be in [1, 12], got " + month);
        }
        if (weekday < 0 || weekday > 6) {
            throw new IllegalArgumentException("weekday must be in [0, 6], got " + weekday);
        }
        this.month = month;
        this.week = Objects.requireNonNull(week, "week");
        this.weekday = weekday;
        this.localTimeMinutes = localTimeMinutes;
        this.basis = Objects.requireNonNull(basis, "basis");
    }

    @Override
    public String toString() {
        return week.name().toLowerCase() + " " + WEEKDAY_NAMES[weekday] + " of month " + month
                + " at " + localTimeMinutes + "min " + basis.name().toLowerCase();
    }
}
