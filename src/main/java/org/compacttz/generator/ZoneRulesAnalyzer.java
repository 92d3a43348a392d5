package org.compacttz.generator;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.shorts.ShortArrayList;
import lombok.Value;
import org.compacttz.core.time.CivilTime;
import org.compacttz.historical.HistoricalTransitionTable;
import org.compacttz.rules.CompactRuleSet;
import org.compacttz.rules.DstRule;
import org.compacttz.rules.OffsetBasis;
import org.compacttz.rules.TransitionRule;
import org.compacttz.rules.TransitionRuleEvaluator;
import org.compacttz.rules.WeekOfMonth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneOffsetTransitionRule;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Derives a zone's compact rule set and historical table from JDK {@link ZoneRules}.
 *
 * <p>The compact rule set is checked against the same {@link ZoneRules} at every transition and
 * at daily samples through the horizon year. Disagreements move {@code rulesValidFrom} forward;
 * a zone that cannot be verified is routed entirely to its historical table.</p>
 */
public final class ZoneRulesAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ZoneRulesAnalyzer.class);
    private static final int MAX_VERIFY_ATTEMPTS = 8;
    private static final int MINUTES_PER_DAY = 1440;

    private final GeneratorConfig config;

    /**
     * Creates an analyzer.
     *
     * @param config year window and always-historical list.
     */
    public ZoneRulesAnalyzer(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    /**
     * Analyzes one zone.
     *
     * @param name canonical zone name.
     * @param rules reference rules of the zone.
     * @return compact rules, historical table and demotion reason.
     */
    public ZoneAnalysis analyze(String name, ZoneRules rules) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rules, "rules");
        List<ZoneOffsetTransition> explicit = rules.getTransitions();
        long lastExplicit = explicit.isEmpty()
                ? CompactRuleSet.VALID_SINCE_FOREVER
                : explicit.get(explicit.size() - 1).toEpochSecond();

        String reason = null;
        CompactRuleSet candidate = null;
        if (config.getAlwaysHistoricalZones().contains(name)) {
            reason = "configured as always-historical";
        } else if (rules.getTransitionRules().isEmpty()) {
            if (!explicit.isEmpty() && CivilTime.yearOfEpochSecond(lastExplicit) > config.getEndYear()) {
                reason = "explicit transitions scheduled past " + config.getEndYear() + " without a recurring rule";
            } else {
                long sampleAt = explicit.isEmpty() ? 0L : lastExplicit;
                candidate = CompactRuleSet.fixed(minutes(rules.getOffset(Instant.ofEpochSecond(sampleAt))), lastExplicit);
            }
        } else {
            try {
                candidate = recurringRuleSet(rules.getTransitionRules(), lastExplicit);
            } catch (UnrepresentableRuleException ex) {
                reason = ex.getMessage();
            }
        }

        CompactRuleSet ruleSet;
        long coverageEnd;
        if (candidate != null) {
            OptionalLong verifiedFrom = verify(rules, candidate);
            if (verifiedFrom.isPresent()) {
                ruleSet = new CompactRuleSet(
                        candidate.getStandardOffsetMinutes(),
                        candidate.getDstRule(),
                        verifiedFrom.getAsLong(),
                        false
                );
                coverageEnd = Math.max(endOfYear(config.getEndYear()), verifiedFrom.getAsLong());
            } else {
                reason = "compact rules disagree with the reference through " + config.getHorizonYear();
                ruleSet = null;
                coverageEnd = 0L;
            }
        } else {
            ruleSet = null;
            coverageEnd = 0L;
        }

        if (ruleSet == null) {
            if (config.getAlwaysHistoricalZones().contains(name)) {
                log.info("Zone {} is always-historical: {}", name, reason);
            } else {
                log.warn("Zone {} demoted to always-historical: {}", name, reason);
            }
            long horizonEnd = endOfYear(config.getHorizonYear());
            int standard = minutes(rules.getStandardOffset(Instant.ofEpochSecond(horizonEnd)));
            ruleSet = new CompactRuleSet(standard, null, CompactRuleSet.VALID_SINCE_FOREVER, true);
            coverageEnd = Math.max(horizonEnd, lastExplicit);
        }
        return new ZoneAnalysis(name, ruleSet, historicalTable(rules, coverageEnd), reason);
    }

    /**
     * Records the offset at the start of the window followed by every offset change up to and
     * including {@code coverageEnd}.
     */
    HistoricalTransitionTable historicalTable(ZoneRules rules, long coverageEnd) {
        long start = CivilTime.startOfYear(config.getStartYear());
        LongArrayList instants = new LongArrayList();
        ShortArrayList offsets = new ShortArrayList();
        int current = minutes(rules.getOffset(Instant.ofEpochSecond(start)));
        instants.add(start);
        offsets.add((short) current);

        ZoneOffsetTransition transition = rules.nextTransition(Instant.ofEpochSecond(start));
        while (transition != null && transition.toEpochSecond() <= coverageEnd) {
            int after = minutes(transition.getOffsetAfter());
            if (after != current) {
                instants.add(transition.toEpochSecond());
                offsets.add((short) after);
                current = after;
            }
            transition = rules.nextTransition(transition.getInstant());
        }
        return HistoricalTransitionTable.of(instants.toLongArray(), offsets.toShortArray());
    }

    private CompactRuleSet recurringRuleSet(List<ZoneOffsetTransitionRule> lastRules, long validFrom) {
        if (lastRules.size() != 2) {
            throw new UnrepresentableRuleException(lastRules.size() + " recurring rules");
        }
        ZoneOffsetTransitionRule first = lastRules.get(0);
        ZoneOffsetTransitionRule second = lastRules.get(1);
        int standardSeconds = first.getStandardOffset().getTotalSeconds();
        if (second.getStandardOffset().getTotalSeconds() != standardSeconds) {
            throw new UnrepresentableRuleException("recurring rules disagree on the standard offset");
        }
        ZoneOffsetTransitionRule start = first.getOffsetAfter().getTotalSeconds() != standardSeconds ? first : second;
        ZoneOffsetTransitionRule end = start == first ? second : first;
        int daylightSeconds = start.getOffsetAfter().getTotalSeconds();
        if (start.getOffsetBefore().getTotalSeconds() != standardSeconds
                || end.getOffsetAfter().getTotalSeconds() != standardSeconds
                || end.getOffsetBefore().getTotalSeconds() != daylightSeconds
                || daylightSeconds == standardSeconds) {
            throw new UnrepresentableRuleException("recurring rules do not alternate between standard and daylight time");
        }
        if (standardSeconds % 60 != 0 || daylightSeconds % 60 != 0) {
            throw new UnrepresentableRuleException("recurring offsets are not whole minutes");
        }
        int standard = standardSeconds / 60;
        int delta = (daylightSeconds - standardSeconds) / 60;
        DstRule dst = new DstRule(
                delta,
                transitionRule(start, standard, delta),
                transitionRule(end, standard, delta)
        );
        return new CompactRuleSet(standard, dst, validFrom, false);
    }

    private static TransitionRule transitionRule(ZoneOffsetTransitionRule rule, int standard, int delta) {
        DayOfWeek dayOfWeek = rule.getDayOfWeek();
        if (dayOfWeek == null) {
            throw new UnrepresentableRuleException("rule on a fixed day of month: " + rule);
        }
        ShiftedOccurrence occurrence = occurrenceOf(rule.getMonth(), rule.getDayOfMonthIndicator());
        int secondOfDay = rule.getLocalTime().toSecondOfDay();
        if (secondOfDay % 60 != 0) {
            throw new UnrepresentableRuleException("rule time is not a whole minute: " + rule);
        }
        int minutes = rule.isMidnightEndOfDay() ? 1440 : secondOfDay / 60;

        OffsetBasis basis;
        switch (rule.getTimeDefinition()) {
            case UTC:
                minutes += standard;
                basis = OffsetBasis.STANDARD;
                break;
            case STANDARD:
                basis = OffsetBasis.STANDARD;
                break;
            case WALL:
                int before = rule.getOffsetBefore().getTotalSeconds() / 60;
                basis = before == standard ? OffsetBasis.STANDARD : OffsetBasis.DAYLIGHT;
                if (before != OffsetBasis.STANDARD.offsetMinutes(standard, delta)
                        && before != OffsetBasis.DAYLIGHT.offsetMinutes(standard, delta)) {
                    throw new UnrepresentableRuleException("wall time relative to an unknown offset: " + rule);
                }
                break;
            default:
                throw new UnrepresentableRuleException("unsupported time definition: " + rule.getTimeDefinition());
        }
        // java.time uses Monday = 1 .. Sunday = 7.
        int weekday = Math.floorMod(dayOfWeek.getValue() - occurrence.getDayShift(), 7);
        minutes += occurrence.getDayShift() * MINUTES_PER_DAY;
        return new TransitionRule(rule.getMonth().getValue(), occurrence.getWeek(), weekday, minutes, basis);
    }

    /**
     * Expresses "weekday on or after day {@code D}" as an occurrence of the weekday
     * {@code dayShift} days earlier, moved forward by {@code dayShift} days.
     *
     * <p>The first to fourth occurrences cover the fixed windows {@code [1, 7]} to
     * {@code [22, 28]}, so shifting one of them by {@code D - start} is exact in every month.
     * The last occurrence is only used outside February, where its window is fixed too. The JDK
     * tz compiler stores "last weekday" as {@code -1} in February and as {@code maxLength - 6}
     * in other months, which map to the last occurrence without a shift.
     * The smallest shift wins; positive shifts win ties.</p>
     */
    static ShiftedOccurrence occurrenceOf(Month month, int dayOfMonthIndicator) {
        if (dayOfMonthIndicator == -1) {
            return new ShiftedOccurrence(WeekOfMonth.LAST, 0);
        }
        if (dayOfMonthIndicator < 1) {
            throw new UnrepresentableRuleException(
                    "weekday on or before day " + dayOfMonthIndicator + " of " + month + " is not supported"
            );
        }
        ShiftedOccurrence best = null;
        for (WeekOfMonth week : WeekOfMonth.values()) {
            int windowStart;
            if (week == WeekOfMonth.LAST) {
                if (month == Month.FEBRUARY) {
                    continue;
                }
                windowStart = month.maxLength() - 6;
            } else {
                windowStart = (week.code() - 1) * 7 + 1;
            }
            int shift = dayOfMonthIndicator - windowStart;
            if (best == null
                    || Math.abs(shift) < Math.abs(best.getDayShift())
                    || (Math.abs(shift) == Math.abs(best.getDayShift()) && shift > best.getDayShift())) {
                best = new ShiftedOccurrence(week, shift);
            }
        }
        return best;
    }

    private OptionalLong verify(ZoneRules rules, CompactRuleSet candidate) {
        long horizonEnd = endOfYear(config.getHorizonYear());
        long validFrom = candidate.getRulesValidFrom();
        for (int attempt = 0; attempt < MAX_VERIFY_ATTEMPTS; attempt++) {
            long from = Math.max(validFrom, CivilTime.startOfYear(config.getStartYear()));
            OptionalLong lastMismatch = lastMismatch(rules, candidate, from, horizonEnd);
            if (lastMismatch.isEmpty()) {
                return OptionalLong.of(validFrom);
            }
            ZoneOffsetTransition next = rules.nextTransition(Instant.ofEpochSecond(lastMismatch.getAsLong()));
            if (next == null || next.toEpochSecond() > horizonEnd) {
                return OptionalLong.empty();
            }
            validFrom = next.toEpochSecond();
        }
        return OptionalLong.empty();
    }

    private OptionalLong lastMismatch(ZoneRules rules, CompactRuleSet candidate, long from, long to) {
        MismatchTracker tracker = new MismatchTracker(rules, candidate, from, to);
        tracker.check(from);

        ZoneOffsetTransition transition = rules.nextTransition(Instant.ofEpochSecond(from));
        while (transition != null && transition.toEpochSecond() <= to) {
            tracker.checkAround(transition.toEpochSecond());
            transition = rules.nextTransition(transition.getInstant());
        }

        DstRule dst = candidate.getDstRule();
        if (dst != null) {
            int standard = candidate.getStandardOffsetMinutes();
            for (int year = CivilTime.yearOfEpochSecond(from) - 1; year <= config.getHorizonYear() + 1; year++) {
                tracker.checkAround(TransitionRuleEvaluator.startInstant(dst, standard, year));
                tracker.checkAround(TransitionRuleEvaluator.endInstant(dst, standard, year));
            }
        }

        long noon = Math.floorDiv(from, CivilTime.SECONDS_PER_DAY) * CivilTime.SECONDS_PER_DAY + CivilTime.SECONDS_PER_DAY / 2;
        for (long ts = noon; ts <= to; ts += CivilTime.SECONDS_PER_DAY) {
            tracker.check(ts);
        }
        return tracker.last();
    }

    private long endOfYear(int year) {
        return CivilTime.startOfYear(year + 1) - 1;
    }

    /**
     * Converts an offset to whole minutes, truncating toward zero.
     */
    static int minutes(ZoneOffset offset) {
        return offset.getTotalSeconds() / 60;
    }

    private static final class MismatchTracker {
        private final ZoneRules rules;
        private final CompactRuleSet candidate;
        private final long from;
        private final long to;
        private long last = Long.MIN_VALUE;
        private boolean found;

        private MismatchTracker(ZoneRules rules, CompactRuleSet candidate, long from, long to) {
            this.rules = rules;
            this.candidate = candidate;
            this.from = from;
            this.to = to;
        }

        void checkAround(long ts) {
            check(ts - 1);
            check(ts);
            check(ts + 1);
        }

        void check(long ts) {
            if (ts < from || ts > to) {
                return;
            }
            int expected = minutes(rules.getOffset(Instant.ofEpochSecond(ts)));
            if (TransitionRuleEvaluator.offsetMinutes(candidate, ts) != expected && (!found || ts > last)) {
                last = ts;
                found = true;
            }
        }

        OptionalLong last() {
            return found ? OptionalLong.of(last) : OptionalLong.empty();
        }
    }

    /**
     * An occurrence of a weekday inside a month, moved by whole days.
     */
    @Value
    static class ShiftedOccurrence {
        WeekOfMonth week;
        int dayShift;
    }

    /**
     * A recurring rule has no compact equivalent.
     */
    static final class UnrepresentableRuleException extends RuntimeException {
        UnrepresentableRuleException(String message) {
            super(message);
        }
    }
}
