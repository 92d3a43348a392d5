package org.compacttz.tz;

import org.compacttz.core.id.NameCatalog;
import org.compacttz.core.id.TimezoneId;
import org.compacttz.data.CorruptEmbeddedDataException;
import org.compacttz.data.EmbeddedTzData;
import org.compacttz.data.TzRuntimeConfig;
import org.compacttz.historical.HistoricalTransitionStore;
import org.compacttz.historical.TransitionTableLoader;
import org.compacttz.historical.ZstdTransitionTableLoader;
import org.compacttz.rules.CompactRuleRegistry;
import org.compacttz.rules.CompactRuleSet;
import org.compacttz.rules.TransitionRuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Offset database: name catalog, compact rules and the lazily populated historical store.
 *
 * <p>Each query first checks the zone's compact rule set. Instants the rules cover are answered
 * arithmetically; everything else falls through to the zone's historical table, which is
 * decoded on first use. Instances are thread-safe.</p>
 */
public final class TzDatabase {
    private static final Logger log = LoggerFactory.getLogger(TzDatabase.class);
    static final String UTC_NAME = "UTC";

    private final NameCatalog catalog;
    private final CompactRuleRegistry rules;
    private final HistoricalTransitionStore historical;

    private TzDatabase(NameCatalog catalog, CompactRuleRegistry rules, HistoricalTransitionStore historical) {
        this.catalog = catalog;
        this.rules = rules;
        this.historical = historical;
    }

    /**
     * Returns the process-wide database over the bundled data, opening it on first call.
     *
     * <p>Resource locations come from {@link TzRuntimeConfig#fromSystemProperties()}. The open is
     * attempted once; when it fails every call raises the same reason code.</p>
     *
     * @throws CorruptEmbeddedDataException If the bundled data is missing or malformed.
     */
    public static TzDatabase embedded() {
        return EmbeddedHolder.INSTANCE.get();
    }

    /**
     * Opens a database over the configured classpath resources.
     *
     * @param config resource locations and limits.
     * @return ready database; historical tables load on demand.
     */
    public static TzDatabase load(TzRuntimeConfig config) {
        Objects.requireNonNull(config, "config");
        EmbeddedTzData data = EmbeddedTzData.open(config);
        TzDatabase database = of(
                data.catalog(),
                data.rules(),
                new ZstdTransitionTableLoader(data.historicalSource(), config.getMaxDecompressedBytes())
        );
        log.info("Opened timezone database: {} zones, {} aliases, {} always-historical",
                data.catalog().size(), data.catalog().aliasCount(), data.rules().alwaysHistoricalCount());
        return database;
    }

    /**
     * Assembles a database from already-built parts.
     *
     * @param catalog name catalog.
     * @param rules compact rules aligned with the catalog.
     * @param loader historical table loader.
     * @return database instance.
     */
    public static TzDatabase of(NameCatalog catalog, CompactRuleRegistry rules, TransitionTableLoader loader) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(loader, "loader");
        if (catalog.size() != rules.size()) {
            throw new IllegalArgumentException("catalog size " + catalog.size() + " != rule count " + rules.size());
        }
        return new TzDatabase(catalog, rules, new HistoricalTransitionStore(catalog.size(), loader));
    }

    /**
     * Resolves a canonical or alias name.
     *
     * @param name zone name.
     * @return zone handle; {@link Tz#UTC} for UTC and its aliases.
     * @throws InvalidTimezoneNameException If the name is null, blank or unknown.
     */
    public Tz parse(String name) {
        return tryParse(name).orElseThrow(() -> new InvalidTimezoneNameException(name));
    }

    /**
     * Resolves a canonical or alias name without throwing.
     */
    public Optional<Tz> tryParse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return catalog.resolve(name).map(this::handleFor);
    }

    /**
     * Returns all canonical names in stable sorted order.
     */
    public List<String> listTimezones() {
        return catalog.canonicalNames();
    }

    /**
     * Returns the offset of a zone at an instant.
     *
     * @param zone canonical zone id of this database's catalog.
     * @param epochSeconds Unix timestamp in seconds.
     * @return offset in minutes east of UTC.
     */
    public int offsetMinutes(TimezoneId zone, long epochSeconds) {
        Objects.requireNonNull(zone, "zone");
        CompactRuleSet ruleSet = rules.get(zone);
        if (!ruleSet.covers(epochSeconds)) {
            return historical.lookup(zone, epochSeconds);
        }
        return TransitionRuleEvaluator.offsetMinutes(ruleSet, epochSeconds);
    }

    /**
     * Looks up an offset by name at an instant given in epoch milliseconds.
     *
     * @param name canonical or alias name.
     * @param epochMillis Unix timestamp in milliseconds; floored to seconds.
     * @return offset in minutes, or empty when the name is unknown.
     */
    public OptionalInt offsetMinutesAtMillis(String name, long epochMillis) {
        Optional<Tz> tz = tryParse(name);
        if (tz.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(tz.get().offsetAtTimestamp(Math.floorDiv(epochMillis, 1000L)));
    }

    /**
     * Returns a zone's compact rule set.
     *
     * @param name canonical or alias name.
     * @return rule set, or empty when the name is unknown.
     */
    public Optional<CompactRuleSet> rules(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return catalog.resolve(name).map(rules::get);
    }

    /**
     * Returns the name catalog.
     */
    public NameCatalog catalog() {
        return catalog;
    }

    /**
     * Returns the historical store, for residency inspection.
     */
    public HistoricalTransitionStore historicalStore() {
        return historical;
    }

    private Tz handleFor(TimezoneId id) {
        if (UTC_NAME.equals(id.getName())) {
            return Tz.UTC;
        }
        return new Tz(this, id);
    }

    /**
     * Result of a single open attempt: the database, or the failure replayed on each access.
     */
    static final class EmbeddedOpen {
        private final TzDatabase database;
        private final CorruptEmbeddedDataException failure;

        EmbeddedOpen(TzRuntimeConfig config) {
            TzDatabase opened = null;
            CorruptEmbeddedDataException failed = null;
            try {
                opened = load(config);
            } catch (CorruptEmbeddedDataException ex) {
                log.error("Embedded timezone database failed to open", ex);
                failed = ex;
            }
            this.database = opened;
            this.failure = failed;
        }

        TzDatabase get() {
            if (failure != null) {
                throw new CorruptEmbeddedDataException(
                        failure.getReasonCode(), "embedded timezone database is unavailable", failure
                );
            }
            return database;
        }
    }

    private static final class EmbeddedHolder {
        private static final EmbeddedOpen INSTANCE = new EmbeddedOpen(TzRuntimeConfig.fromSystemProperties());
    }
}
