package org.compacttz.data;

import com.google.flatbuffers.ArrayReadWriteBuf;
import com.google.flatbuffers.FlexBuffers;
import com.google.flatbuffers.FlexBuffersBuilder;
import lombok.experimental.UtilityClass;
import org.compacttz.rules.CompactRuleSet;
import org.compacttz.rules.DstRule;
import org.compacttz.rules.OffsetBasis;
import org.compacttz.rules.TransitionRule;
import org.compacttz.rules.WeekOfMonth;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * FlexBuffers codec for the compact-rules resource.
 *
 * <p>Root map keys: {@code version}, {@code names}, {@code aliasNames}, {@code aliasTargets}
 * (canonical index per alias) and {@code zones}. Each zone is a vector of integers:
 * {@code [std, validFrom, alwaysHistorical, hasDst]} followed, when {@code hasDst = 1}, by
 * {@code delta} and five fields per rule ({@code month, week, weekday, minutes, basis}) for the
 * start and end rules.</p>
 */
@UtilityClass
public final class CompactRulesCodec {
    public static final int FORMAT_VERSION = 1;

    private static final String KEY_VERSION = "version";
    private static final String KEY_NAMES = "names";
    private static final String KEY_ALIAS_NAMES = "aliasNames";
    private static final String KEY_ALIAS_TARGETS = "aliasTargets";
    private static final String KEY_ZONES = "zones";
    private static final int FIXED_FIELDS = 4;
    private static final int RULE_FIELDS = 5;
    private static final int DST_FIELDS = FIXED_FIELDS + 1 + 2 * RULE_FIELDS;

    /**
     * Serializes a compact-rules document.
     *
     * @param document names, aliases and aligned rule sets.
     * @return FlexBuffers bytes.
     */
    public static byte[] encode(CompactRulesDocument document) {
        Objects.requireNonNull(document, "document");
        List<String> names = document.getCanonicalNames();
        List<CompactRuleSet> rules = document.getRules();
        if (names.size() != rules.size()) {
            throw new IllegalArgumentException("names and rules must be aligned: " + names.size() + " != " + rules.size());
        }
        Map<String, Integer> indexByName = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            indexByName.put(names.get(i), i);
        }

        FlexBuffersBuilder builder = new FlexBuffersBuilder(
                new ArrayReadWriteBuf(64 * 1024),
                FlexBuffersBuilder.BUILDER_FLAG_SHARE_KEYS_AND_STRINGS
        );
        int root = builder.startMap();
        builder.putInt(KEY_VERSION, FORMAT_VERSION);

        int namesStart = builder.startVector();
        for (String name : names) {
            builder.putString(name);
        }
        builder.endVector(KEY_NAMES, namesStart, false, false);

        int aliasNamesStart = builder.startVector();
        for (String alias : document.getAliases().keySet()) {
            builder.putString(alias);
        }
        builder.endVector(KEY_ALIAS_NAMES, aliasNamesStart, false, false);

        int aliasTargetsStart = builder.startVector();
        for (Map.Entry<String, String> alias : document.getAliases().entrySet()) {
            Integer target = indexByName.get(alias.getValue());
            if (target == null) {
                throw new IllegalArgumentException("alias " + alias.getKey() + " targets unknown name " + alias.getValue());
            }
            builder.putInt(target);
        }
        builder.endVector(KEY_ALIAS_TARGETS, aliasTargetsStart, false, false);

        int zonesStart = builder.startVector();
        for (CompactRuleSet ruleSet : rules) {
            int zoneStart = builder.startVector();
            builder.putInt(ruleSet.getStandardOffsetMinutes());
            builder.putInt(ruleSet.getRulesValidFrom());
            builder.putInt(ruleSet.isAlwaysHistorical() ? 1 : 0);
            DstRule dst = ruleSet.getDstRule();
            builder.putInt(dst == null ? 0 : 1);
            if (dst != null) {
                builder.putInt(dst.getDstOffsetDeltaMinutes());
                putRule(builder, dst.getStartRule());
                putRule(builder, dst.getEndRule());
            }
            builder.endVector(null, zoneStart, false, false);
        }
        builder.endVector(KEY_ZONES, zonesStart, false, false);
        builder.endMap(null, root);

        ByteBuffer finished = builder.finish();
        byte[] out = new byte[finished.remaining()];
        finished.get(out);
        return out;
    }

    /**
     * Parses a compact-rules document.
     *
     * @param bytes FlexBuffers bytes.
     * @return decoded document.
     * @throws CorruptEmbeddedDataException If the bytes do not hold a valid document.
     */
    public static CompactRulesDocument decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            throw malformed("compact rules resource is empty", null);
        }
        try {
            FlexBuffers.Reference root = FlexBuffers.getRoot(new ArrayReadWriteBuf(bytes, bytes.length));
            if (!root.isMap()) {
                throw malformed("compact rules root is not a map", null);
            }
            FlexBuffers.Map map = root.asMap();
            long version = map.get(KEY_VERSION).asLong();
            if (version != FORMAT_VERSION) {
                throw new CorruptEmbeddedDataException(
                        CorruptEmbeddedDataException.REASON_UNSUPPORTED_VERSION,
                        "compact rules version " + version + " is not supported"
                );
            }

            FlexBuffers.Vector namesVector = requireVector(map, KEY_NAMES);
            List<String> names = new ArrayList<>(namesVector.size());
            for (int i = 0; i < namesVector.size(); i++) {
                names.add(namesVector.get(i).asString());
            }

            FlexBuffers.Vector aliasNames = requireVector(map, KEY_ALIAS_NAMES);
            FlexBuffers.Vector aliasTargets = requireVector(map, KEY_ALIAS_TARGETS);
            if (aliasNames.size() != aliasTargets.size()) {
                throw malformed("alias names and targets are not aligned", null);
            }
            Map<String, String> aliases = new LinkedHashMap<>();
            for (int i = 0; i < aliasNames.size(); i++) {
                int target = (int) aliasTargets.get(i).asLong();
                if (target < 0 || target >= names.size()) {
                    throw malformed("alias target index out of range: " + target, null);
                }
                aliases.put(aliasNames.get(i).asString(), names.get(target));
            }

            FlexBuffers.Vector zones = requireVector(map, KEY_ZONES);
            if (zones.size() != names.size()) {
                throw new CorruptEmbeddedDataException(
                        CorruptEmbeddedDataException.REASON_ZONE_COUNT_MISMATCH,
                        "compact rules hold " + zones.size() + " zones for " + names.size() + " names"
                );
            }
            List<CompactRuleSet> rules = new ArrayList<>(zones.size());
            for (int i = 0; i < zones.size(); i++) {
                rules.add(readZone(zones.get(i).asVector(), names.get(i)));
            }
            return new CompactRulesDocument(
                    Collections.unmodifiableList(names),
                    Collections.unmodifiableMap(aliases),
                    Collections.unmodifiableList(rules)
            );
        } catch (CorruptEmbeddedDataException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw malformed("compact rules resource failed to decode: " + ex.getMessage(), ex);
        }
    }

    private static void putRule(FlexBuffersBuilder builder, TransitionRule rule) {
        builder.putInt(rule.getMonth());
        builder.putInt(rule.getWeek().code());
        builder.putInt(rule.getWeekday());
        builder.putInt(rule.getLocalTimeMinutes());
        builder.putInt(rule.getBasis().code());
    }

    private static CompactRuleSet readZone(FlexBuffers.Vector zone, String name) {
        int size = zone.size();
        if (size != FIXED_FIELDS && size != DST_FIELDS) {
            throw malformed("zone " + name + " has " + size + " fields", null);
        }
        int standard = (int) zone.get(0).asLong();
        long validFrom = zone.get(1).asLong();
        boolean alwaysHistorical = zone.get(2).asLong() != 0;
        boolean hasDst = zone.get(3).asLong() != 0;
        if (hasDst != (size == DST_FIELDS)) {
            throw malformed("zone " + name + " DST flag disagrees with field count", null);
        }
        DstRule dst = null;
        if (hasDst) {
            int delta = (int) zone.get(FIXED_FIELDS).asLong();
            TransitionRule start = readRule(zone, FIXED_FIELDS + 1);
            TransitionRule end = readRule(zone, FIXED_FIELDS + 1 + RULE_FIELDS);
            dst = new DstRule(delta, start, end);
        }
        return new CompactRuleSet(standard, dst, validFrom, alwaysHistorical);
    }

    private static TransitionRule readRule(FlexBuffers.Vector zone, int at) {
        return new TransitionRule(
                (int) zone.get(at).asLong(),
                WeekOfMonth.fromCode((int) zone.get(at + 1).asLong()),
                (int) zone.get(at + 2).asLong(),
                (int) zone.get(at + 3).asLong(),
                OffsetBasis.fromCode((int) zone.get(at + 4).asLong())
        );
    }

    private static FlexBuffers.Vector requireVector(FlexBuffers.Map map, String key) {
        FlexBuffers.Reference reference = map.get(key);
        if (reference.isNull() || !reference.isVector()) {
            throw malformed("compact rules key '" + key + "' is missing", null);
        }
        return reference.asVector();
    }

    private static CorruptEmbeddedDataException malformed(String message, Throwable cause) {
        if (cause == null) {
            return new CorruptEmbeddedDataException(CorruptEmbeddedDataException.REASON_MALFORMED_RULES, message);
        }
        return new CorruptEmbeddedDataException(CorruptEmbeddedDataException.REASON_MALFORMED_RULES, message, cause);
    }
}
