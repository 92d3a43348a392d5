package org.compacttz.generator;

import org.compacttz.historical.HistoricalTransitionTable;
import org.compacttz.rules.CompactRuleSet;
import org.compacttz.rules.DstRule;
import org.compacttz.rules.OffsetBasis;
import org.compacttz.rules.TransitionRule;
import org.compacttz.rules.TransitionRuleEvaluator;
import org.compacttz.rules.WeekOfMonth;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.zone.ZoneRules;

import static org.junit.jupiter.api.Assertions.*;

class ZoneRulesAnalyzerTest {

    private final ZoneRulesAnalyzer analyzer = new ZoneRulesAnalyzer(GeneratorConfig.defaults());

    @Test
    @DisplayName("New York: second Sunday of March to first Sunday of November, both at 02:00 wall time")
    void testNewYorkRule() {
        ZoneAnalysis analysis = analyzer.analyze("America/New_York", ZoneId.of("America/New_York").getRules());
        CompactRuleSet rules = analysis.getRules();

        assertNull(analysis.getHistoricalReason());
        assertFalse(rules.isAlwaysHistorical());
        assertEquals(-300, rules.getStandardOffsetMinutes());
        DstRule dst = rules.getDstRule();
        assertEquals(60, dst.getDstOffsetDeltaMinutes());
        assertEquals(new TransitionRule(3, WeekOfMonth.SECOND, 0, 120, OffsetBasis.STANDARD), dst.getStartRule());
        assertEquals(new TransitionRule(11, WeekOfMonth.FIRST, 0, 120, OffsetBasis.DAYLIGHT), dst.getEndRule());
        assertTrue(rules.getRulesValidFrom() > 1151712000L); // after 2006-07-01
        assertTrue(rules.getRulesValidFrom() < 1704067200L); // before 2024
    }

    @Test
    @DisplayName("London: last-Sunday rules defined in UTC are rebased onto standard time")
    void testLondonRule() {
        DstRule dst = analyzer.analyze("Europe/London", ZoneId.of("Europe/London").getRules()).getRules().getDstRule();
        assertEquals(new TransitionRule(3, WeekOfMonth.LAST, 0, 60, OffsetBasis.STANDARD), dst.getStartRule());
        assertEquals(new TransitionRule(10, WeekOfMonth.LAST, 0, 60, OffsetBasis.STANDARD), dst.getEndRule());
    }

    @Test
    @DisplayName("Sydney: southern-hemisphere rule starts in October and ends in April")
    void testSydneyRule() {
        CompactRuleSet rules = analyzer.analyze("Australia/Sydney", ZoneId.of("Australia/Sydney").getRules()).getRules();
        assertEquals(600, rules.getStandardOffsetMinutes());
        assertTrue(rules.getDstRule().spansYearBoundary());
        assertEquals(10, rules.getDstRule().getStartRule().getMonth());
        assertEquals(4, rules.getDstRule().getEndRule().getMonth());
    }

    @Test
    @DisplayName("Tokyo and UTC have fixed compact rules")
    void testFixedZones() {
        CompactRuleSet tokyo = analyzer.analyze("Asia/Tokyo", ZoneId.of("Asia/Tokyo").getRules()).getRules();
        assertEquals(540, tokyo.getStandardOffsetMinutes());
        assertNull(tokyo.getDstRule());
        assertFalse(tokyo.isAlwaysHistorical());

        ZoneAnalysis utc = analyzer.analyze("UTC", ZoneOffset.UTC.getRules());
        assertEquals(CompactRuleSet.VALID_SINCE_FOREVER, utc.getRules().getRulesValidFrom());
        assertEquals(1, utc.getTable().size());
    }

    @Test
    @DisplayName("Configured and unrepresentable zones become always-historical through the horizon")
    void testAlwaysHistorical() {
        ZoneAnalysis casablanca = analyzer.analyze("Africa/Casablanca", ZoneId.of("Africa/Casablanca").getRules());
        assertTrue(casablanca.getRules().isAlwaysHistorical());
        assertNotNull(casablanca.getHistoricalReason());
        assertTrue(casablanca.getTable().lastInstant() > 1893456000L); // beyond 2030

        ZoneRulesAnalyzer unlisted = new ZoneRulesAnalyzer(GeneratorConfig.builder().build());
        ZoneAnalysis demoted = unlisted.analyze("Africa/Casablanca", ZoneId.of("Africa/Casablanca").getRules());
        assertTrue(demoted.getRules().isAlwaysHistorical());
        assertNotNull(demoted.getHistoricalReason());
    }

    @Test
    @DisplayName("Historical tables start at 1970 and only record offset changes")
    void testHistoricalTable() {
        HistoricalTransitionTable table = analyzer.analyze("America/New_York", ZoneId.of("America/New_York").getRules()).getTable();
        assertEquals(0L, table.firstInstant());
        assertEquals(-300, table.offsetMinutesAt(0));
        for (int i = 1; i < table.size(); i++) {
            assertNotEquals(table.offsetMinutesAt(i - 1), table.offsetMinutesAt(i));
        }
    }

    @Test
    @DisplayName("Day-of-month indicators map to weeks, including the JDK's stored form of 'last'")
    void testOccurrenceOf() {
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.FIRST, 0), ZoneRulesAnalyzer.occurrenceOf(Month.NOVEMBER, 1));
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.SECOND, 0), ZoneRulesAnalyzer.occurrenceOf(Month.MARCH, 8));
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.THIRD, 0), ZoneRulesAnalyzer.occurrenceOf(Month.MARCH, 15));
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.FOURTH, 0), ZoneRulesAnalyzer.occurrenceOf(Month.MARCH, 22));
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.LAST, 0), ZoneRulesAnalyzer.occurrenceOf(Month.MARCH, 25));
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.LAST, 0), ZoneRulesAnalyzer.occurrenceOf(Month.APRIL, 24));
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.LAST, 0), ZoneRulesAnalyzer.occurrenceOf(Month.FEBRUARY, -1));
    }

    @Test
    @DisplayName("'Weekday on or after day D' becomes a shifted occurrence of an earlier weekday")
    void testShiftedOccurrences() {
        // Chile: Sun>=2
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.FIRST, 1), ZoneRulesAnalyzer.occurrenceOf(Month.SEPTEMBER, 2));
        // Egypt: Fri>=26 October
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.LAST, 1), ZoneRulesAnalyzer.occurrenceOf(Month.OCTOBER, 26));
        // Israel: Fri>=23 March
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.FOURTH, 1), ZoneRulesAnalyzer.occurrenceOf(Month.MARCH, 23));
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.THIRD, -2), ZoneRulesAnalyzer.occurrenceOf(Month.MARCH, 13));
        // February never uses the last occurrence: its window moves in leap years.
        assertEquals(new ZoneRulesAnalyzer.ShiftedOccurrence(WeekOfMonth.FOURTH, 1), ZoneRulesAnalyzer.occurrenceOf(Month.FEBRUARY, 23));
        assertThrows(ZoneRulesAnalyzer.UnrepresentableRuleException.class, () -> ZoneRulesAnalyzer.occurrenceOf(Month.OCTOBER, -2));
    }

    @Test
    @DisplayName("Santiago: Sunday on or after the 2nd at 04:00/03:00 UTC becomes first Saturday plus a day")
    void testSantiagoRule() {
        ZoneAnalysis analysis = analyzer.analyze("America/Santiago", ZoneId.of("America/Santiago").getRules());
        assertNull(analysis.getHistoricalReason());
        DstRule dst = analysis.getRules().getDstRule();
        assertEquals(-240, analysis.getRules().getStandardOffsetMinutes());
        assertEquals(new TransitionRule(9, WeekOfMonth.FIRST, 6, 1440, OffsetBasis.STANDARD), dst.getStartRule());
        assertEquals(new TransitionRule(4, WeekOfMonth.FIRST, 6, 1380, OffsetBasis.STANDARD), dst.getEndRule());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Africa/Cairo", "America/Santiago", "Pacific/Easter", "Asia/Jerusalem"})
    @DisplayName("Zones with 'on or after' rules stay on the compact path and match the reference weekly 2040-2052")
    void testOnOrAfterZonesStayCompact(String name) {
        ZoneRules reference = ZoneId.of(name).getRules();
        ZoneAnalysis analysis = analyzer.analyze(name, reference);
        CompactRuleSet rules = analysis.getRules();
        assertNull(analysis.getHistoricalReason(), name);
        assertFalse(rules.isAlwaysHistorical(), name);

        long from = 2208988800L; // 2040-01-01T00:00:00Z
        long to = 2619302400L;   // 2053-01-01T00:00:00Z
        for (long ts = from; ts < to; ts += 7 * 86400L + 3600L) {
            assertEquals(
                    ZoneRulesAnalyzer.minutes(reference.getOffset(Instant.ofEpochSecond(ts))),
                    TransitionRuleEvaluator.offsetMinutes(rules, ts),
                    name + " @" + ts
            );
        }
    }

    @Test
    @DisplayName("Configuration rejects inverted year windows")
    void testConfigValidation() {
        GeneratorConfig inverted = GeneratorConfig.builder().startYear(2030).endYear(2020).build();
        assertThrows(IllegalArgumentException.class, () -> new ZoneRulesAnalyzer(inverted));
    }
}
