package org.compacttz.rules;

import org.compacttz.core.time.CivilTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

import static org.junit.jupiter.api.Assertions.*;

class TransitionRuleEvaluatorTest {

    private static final int NY_STD = -300;
    private static final DstRule US_DST = new DstRule(
            60,
            new TransitionRule(3, WeekOfMonth.SECOND, 0, 120, OffsetBasis.STANDARD),
            new TransitionRule(11, WeekOfMonth.FIRST, 0, 120, OffsetBasis.DAYLIGHT)
    );

    private static final int SYDNEY_STD = 600;
    private static final DstRule AU_DST = new DstRule(
            60,
            new TransitionRule(10, WeekOfMonth.FIRST, 0, 120, OffsetBasis.STANDARD),
            new TransitionRule(4, WeekOfMonth.FIRST, 0, 120, OffsetBasis.STANDARD)
    );

    // ========== Instant Resolution ==========

    @Test
    @DisplayName("US 2024: DST starts 2024-03-10T07:00Z and ends 2024-11-03T06:00Z")
    void testUsTransitions2024() {
        assertEquals(1710054000L, TransitionRuleEvaluator.startInstant(US_DST, NY_STD, 2024));
        assertEquals(1730613600L, TransitionRuleEvaluator.endInstant(US_DST, NY_STD, 2024));
    }

    @Test
    @DisplayName("EU 2024: last Sunday of March at 01:00 UTC, rebased onto +01:00 standard")
    void testLastSundayRule() {
        TransitionRule euStart = new TransitionRule(3, WeekOfMonth.LAST, 0, 120, OffsetBasis.STANDARD);
        assertEquals(1711846800L, TransitionRuleEvaluator.resolveInstant(euStart, 2024, 60));
    }

    @Test
    @DisplayName("Nth and last weekday selection agrees with java.time adjusters 1970-2040")
    void testWeekdaySelectionMatchesJavaTime() {
        WeekOfMonth[] nth = {WeekOfMonth.FIRST, WeekOfMonth.SECOND, WeekOfMonth.THIRD, WeekOfMonth.FOURTH};
        for (int year = 1970; year <= 2040; year++) {
            for (int month = 1; month <= 12; month++) {
                for (DayOfWeek dow : DayOfWeek.values()) {
                    int weekday = dow.getValue() % 7;
                    LocalDate first = LocalDate.of(year, month, 1);
                    for (int n = 0; n < nth.length; n++) {
                        TransitionRule rule = new TransitionRule(month, nth[n], weekday, 0, OffsetBasis.STANDARD);
                        long expected = first.with(TemporalAdjusters.dayOfWeekInMonth(n + 1, dow)).toEpochDay();
                        assertEquals(expected, TransitionRuleEvaluator.transitionEpochDay(rule, year), rule + " " + year);
                    }
                    TransitionRule last = new TransitionRule(month, WeekOfMonth.LAST, weekday, 0, OffsetBasis.STANDARD);
                    long expectedLast = first.with(TemporalAdjusters.lastInMonth(dow)).toEpochDay();
                    assertEquals(expectedLast, TransitionRuleEvaluator.transitionEpochDay(last, year), last + " " + year);
                }
            }
        }
    }

    @Test
    @DisplayName("Local times past midnight roll into the next day")
    void testLocalTimeBeyondDay() {
        TransitionRule rule = new TransitionRule(3, WeekOfMonth.LAST, 0, 1440 + 60, OffsetBasis.STANDARD);
        long sunday = TransitionRuleEvaluator.transitionEpochDay(rule, 2024);
        assertEquals((sunday + 1) * CivilTime.SECONDS_PER_DAY + 3600, TransitionRuleEvaluator.resolveInstant(rule, 2024, 0));
    }

    // ========== DST Activity: Northern Pattern ==========

    @Test
    @DisplayName("Northern pattern boundaries are half-open: [start, end)")
    void testNorthernBoundaries() {
        CompactRuleSet ny = new CompactRuleSet(NY_STD, US_DST, 0L, false);
        assertEquals(-300, TransitionRuleEvaluator.offsetMinutes(ny, 1710054000L - 1));
        assertEquals(-240, TransitionRuleEvaluator.offsetMinutes(ny, 1710054000L));
        assertEquals(-240, TransitionRuleEvaluator.offsetMinutes(ny, 1730613600L - 1));
        assertEquals(-300, TransitionRuleEvaluator.offsetMinutes(ny, 1730613600L));
        assertEquals(-300, TransitionRuleEvaluator.offsetMinutes(ny, 1704067200L));
    }

    // ========== DST Activity: Southern Pattern ==========

    @Test
    @DisplayName("Southern pattern: DST spans December 31 and January 1")
    void testSouthernAcrossNewYear() {
        assertTrue(TransitionRuleEvaluator.isDstActive(AU_DST, SYDNEY_STD, 1704063600L)); // 2023-12-31T23:00Z
        assertTrue(TransitionRuleEvaluator.isDstActive(AU_DST, SYDNEY_STD, 1704069000L)); // 2024-01-01T00:30Z
        assertFalse(TransitionRuleEvaluator.isDstActive(AU_DST, SYDNEY_STD, 1719792000L)); // 2024-07-01T00:00Z
    }

    @Test
    @DisplayName("Southern pattern boundaries: standard time is [end, start)")
    void testSouthernBoundaries() {
        long end2024 = TransitionRuleEvaluator.endInstant(AU_DST, SYDNEY_STD, 2024);
        long start2024 = TransitionRuleEvaluator.startInstant(AU_DST, SYDNEY_STD, 2024);
        assertEquals(1712419200L, end2024);
        assertEquals(1728144000L, start2024);

        CompactRuleSet sydney = new CompactRuleSet(SYDNEY_STD, AU_DST, 0L, false);
        assertEquals(660, TransitionRuleEvaluator.offsetMinutes(sydney, end2024 - 1));
        assertEquals(600, TransitionRuleEvaluator.offsetMinutes(sydney, end2024));
        assertEquals(600, TransitionRuleEvaluator.offsetMinutes(sydney, start2024 - 1));
        assertEquals(660, TransitionRuleEvaluator.offsetMinutes(sydney, start2024));
    }

    @Test
    @DisplayName("Year boundary: next year's end rule resolves before the UTC year ends")
    void testEndRuleResolvedIntoPreviousUtcYear() {
        // +13:00 zone whose DST ends on the first Sunday of January at 12:00 daylight time.
        // 2023-01-01 was a Sunday, so the 2023 end lands on 2022-12-31T22:00Z.
        DstRule dst = new DstRule(
                60,
                new TransitionRule(9, WeekOfMonth.LAST, 0, 120, OffsetBasis.STANDARD),
                new TransitionRule(1, WeekOfMonth.FIRST, 0, 720, OffsetBasis.DAYLIGHT)
        );
        long end2023 = TransitionRuleEvaluator.endInstant(dst, 780, 2023);
        assertEquals(1672524000L, end2023);
        assertEquals(2022, CivilTime.yearOfEpochSecond(end2023));

        CompactRuleSet zone = new CompactRuleSet(780, dst, 0L, false);
        assertEquals(840, TransitionRuleEvaluator.offsetMinutes(zone, end2023 - 3600));
        assertEquals(780, TransitionRuleEvaluator.offsetMinutes(zone, end2023));
        assertEquals(780, TransitionRuleEvaluator.offsetMinutes(zone, end2023 + 3600));
    }

    @Test
    @DisplayName("Zones without DST always return the standard offset")
    void testFixedOffset() {
        CompactRuleSet tokyo = CompactRuleSet.fixed(540, CompactRuleSet.VALID_SINCE_FOREVER);
        assertEquals(540, TransitionRuleEvaluator.offsetMinutes(tokyo, 1710054000L));
        assertEquals(540, TransitionRuleEvaluator.offsetMinutes(tokyo, -4_000_000_000L));
    }

    @Test
    @DisplayName("Utility class cannot be instantiated")
    void testPrivateConstructorThrows() throws Exception {
        var ctor = TransitionRuleEvaluator.class.getDeclaredConstructor();
        ctor.setAccessible(true);
        var ex = assertThrows(java.lang.reflect.InvocationTargetException.class, ctor::newInstance);
        assertTrue(ex.getCause() instanceof AssertionError);
    }
}
