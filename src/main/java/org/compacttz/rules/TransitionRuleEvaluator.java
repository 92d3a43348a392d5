package org.compacttz.rules;

import org.compacttz.core.time.CivilTime;

import java.util.Objects;

/**
 * Resolves symbolic transition rules into UTC instants and evaluates compact rule sets.
 *
 * <p>A rule resolved for calendar year {@code Y} can land just before {@code Y} starts or just
 * after it ends once converted to UTC. Every DST decision therefore resolves the rules for the
 * query's UTC year and both adjacent years, and picks the interval that contains the query.</p>
 */
public final class TransitionRuleEvaluator {

    private TransitionRuleEvaluator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Computes the UTC instant at which the rule's wall-clock condition occurs in a year.
     *
     * @param rule transition rule.
     * @param year calendar year the rule is resolved in.
     * @param basisOffsetMinutes offset the rule's local time is expressed in.
     * @return Unix timestamp in seconds.
     */
    public static long resolveInstant(TransitionRule rule, int year, int basisOffsetMinutes) {
        Objects.requireNonNull(rule, "rule");
        long day = transitionEpochDay(rule, year);
        long localSeconds = day * CivilTime.SECONDS_PER_DAY + rule.getLocalTimeMinutes() * CivilTime.SECONDS_PER_MINUTE;
        return localSeconds - basisOffsetMinutes * CivilTime.SECONDS_PER_MINUTE;
    }

    /**
     * Finds the epoch day selected by the rule's month, week and weekday.
     */
    static long transitionEpochDay(TransitionRule rule, int year) {
        int month = rule.getMonth();
        long firstOfMonth = CivilTime.epochDay(year, month, 1);
        if (rule.getWeek() == WeekOfMonth.LAST) {
            long lastOfMonth = firstOfMonth + CivilTime.daysInMonth(year, month) - 1;
            int daysBack = Math.floorMod(CivilTime.dayOfWeek(lastOfMonth) - rule.getWeekday(), 7);
            return lastOfMonth - daysBack;
        }
        int daysForward = Math.floorMod(rule.getWeekday() - CivilTime.dayOfWeek(firstOfMonth), 7);
        // The 4th occurrence is at most day 28, so FIRST..FOURTH never leave the month.
        return firstOfMonth + daysForward + (rule.getWeek().code() - 1) * 7L;
    }

    /**
     * Resolves a DST rule's start instant for a year (basis per the start rule).
     */
    public static long startInstant(DstRule dst, int standardOffsetMinutes, int year) {
        TransitionRule start = dst.getStartRule();
        return resolveInstant(start, year, start.getBasis().offsetMinutes(standardOffsetMinutes, dst.getDstOffsetDeltaMinutes()));
    }

    /**
     * Resolves a DST rule's end instant for a year (basis per the end rule).
     */
    public static long endInstant(DstRule dst, int standardOffsetMinutes, int year) {
        TransitionRule end = dst.getEndRule();
        return resolveInstant(end, year, end.getBasis().offsetMinutes(standardOffsetMinutes, dst.getDstOffsetDeltaMinutes()));
    }

    /**
     * Decides whether DST is in effect at an instant.
     *
     * <p>When the start month precedes the end month DST is a single interval
     * {@code [start(y), end(y))} per year. Otherwise it wraps the year boundary and standard time
     * is the interval {@code [end(y), start(y))}. Both are tested for years {@code y-1..y+1}.</p>
     *
     * @param dst DST schedule.
     * @param standardOffsetMinutes zone standard offset.
     * @param epochSeconds Unix timestamp in seconds.
     * @return true when the DST delta applies.
     */
    public static boolean isDstActive(DstRule dst, int standardOffsetMinutes, long epochSeconds) {
        Objects.requireNonNull(dst, "dst");
        int year = CivilTime.yearOfEpochSecond(epochSeconds);
        boolean wraps = spansYearBoundary(dst, standardOffsetMinutes, year);
        for (int y = year - 1; y <= year + 1; y++) {
            long start = startInstant(dst, standardOffsetMinutes, y);
            long end = endInstant(dst, standardOffsetMinutes, y);
            if (!wraps && epochSeconds >= start && epochSeconds < end) {
                return true;
            }
            if (wraps && epochSeconds >= end && epochSeconds < start) {
                return false;
            }
        }
        return wraps;
    }

    /**
     * Computes the compact-path offset of a rule set, ignoring its validity window.
     *
     * @param rules compact rule set.
     * @param epochSeconds Unix timestamp in seconds.
     * @return offset in minutes east of UTC.
     */
    public static int offsetMinutes(CompactRuleSet rules, long epochSeconds) {
        Objects.requireNonNull(rules, "rules");
        DstRule dst = rules.getDstRule();
        int standard = rules.getStandardOffsetMinutes();
        if (dst == null) {
            return standard;
        }
        return isDstActive(dst, standard, epochSeconds) ? standard + dst.getDstOffsetDeltaMinutes() : standard;
    }

    private static boolean spansYearBoundary(DstRule dst, int standardOffsetMinutes, int year) {
        if (dst.getStartRule().getMonth() != dst.getEndRule().getMonth()) {
            return dst.spansYearBoundary();
        }
        return startInstant(dst, standardOffsetMinutes, year) > endInstant(dst, standardOffsetMinutes, year);
    }
}
