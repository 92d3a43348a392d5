package org.compacttz.core.time;

/**
 * Shared proleptic-Gregorian calendar helpers for transition-rule evaluation.
 *
 * <p>All methods operate on UTC epoch days/seconds and are safe for negative timestamps.
 * Day conversions follow Howard Hinnant's civil-date algorithms.</p>
 */
public final class CivilTime {

    public static final long SECONDS_PER_MINUTE = 60L;
    public static final long SECONDS_PER_DAY = 86_400L;
    private static final int DAYS_PER_WEEK = 7;
    private static final long DAYS_PER_ERA = 146_097L;
    // Days from 0000-03-01 to 1970-01-01.
    private static final long EPOCH_SHIFT_DAYS = 719_468L;
    // Unix epoch started on Thursday (1970-01-01). Sunday = 0 convention.
    private static final int EPOCH_DAY_OF_WEEK = 4;

    /**
     * Prevents instantiation of this utility class.
     */
    private CivilTime() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Converts a civil date to days since the Unix epoch.
     *
     * @param year proleptic Gregorian year.
     * @param month month in range {@code [1, 12]}.
     * @param day day of month in range {@code [1, 31]}.
     * @return epoch day.
     */
    public static long epochDay(int year, int month, int day) {
        requireMonth(month);
        long y = month <= 2 ? (long) year - 1 : year;
        long era = Math.floorDiv(y, 400L);
        long yearOfEra = y - era * 400L;
        long shiftedMonth = month > 2 ? month - 3 : month + 9;
        long dayOfYear = (153L * shiftedMonth + 2L) / 5L + day - 1L;
        long dayOfEra = yearOfEra * 365L + yearOfEra / 4L - yearOfEra / 100L + dayOfYear;
        return era * DAYS_PER_ERA + dayOfEra - EPOCH_SHIFT_DAYS;
    }

    /**
     * Returns the civil year containing the given epoch day.
     *
     * @param epochDay days since 1970-01-01.
     * @return proleptic Gregorian year.
     */
    public static int yearOfEpochDay(long epochDay) {
        long days = epochDay + EPOCH_SHIFT_DAYS;
        long era = Math.floorDiv(days, DAYS_PER_ERA);
        long dayOfEra = days - era * DAYS_PER_ERA;
        long yearOfEra = (dayOfEra - dayOfEra / 1460L + dayOfEra / 36_524L - dayOfEra / 146_096L) / 365L;
        long dayOfYear = dayOfEra - (365L * yearOfEra + yearOfEra / 4L - yearOfEra / 100L);
        long shiftedMonth = (5L * dayOfYear + 2L) / 153L;
        long year = yearOfEra + era * 400L;
        // Shifted months 10 and 11 are January and February of the following civil year.
        return (int) (shiftedMonth >= 10 ? year + 1 : year);
    }

    /**
     * Returns the UTC civil year of a Unix timestamp.
     *
     * @param epochSec Unix timestamp in seconds (UTC).
     * @return proleptic Gregorian year.
     */
    public static int yearOfEpochSecond(long epochSec) {
        return yearOfEpochDay(Math.floorDiv(epochSec, SECONDS_PER_DAY));
    }

    /**
     * Extracts day of week from an epoch day.
     *
     * @param epochDay days since 1970-01-01.
     * @return day-of-week where Sunday = 0 and Saturday = 6.
     */
    public static int dayOfWeek(long epochDay) {
        return (int) Math.floorMod(epochDay + EPOCH_DAY_OF_WEEK, (long) DAYS_PER_WEEK);
    }

    /**
     * Returns {@code true} for Gregorian leap years.
     */
    public static boolean isLeapYear(int year) {
        return (year % 4 == 0) && (year % 100 != 0 || year % 400 == 0);
    }

    /**
     * Returns number of days in the given month.
     *
     * @param year proleptic Gregorian year.
     * @param month month in range {@code [1, 12]}.
     * @return day count in range {@code [28, 31]}.
     */
    public static int daysInMonth(int year, int month) {
        requireMonth(month);
        switch (month) {
            case 2:
                return isLeapYear(year) ? 29 : 28;
            case 4:
            case 6:
            case 9:
            case 11:
                return 30;
            default:
                return 31;
        }
    }

    /**
     * Returns the epoch second of {@code year-01-01T00:00:00Z}.
     */
    public static long startOfYear(int year) {
        return epochDay(year, 1, 1) * SECONDS_PER_DAY;
    }

    private static void requireMonth(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be in [1, 12], got " + month);
        }
    }
}
