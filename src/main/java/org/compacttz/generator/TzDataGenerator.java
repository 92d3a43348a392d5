package org.compacttz.generator;

import org.compacttz.data.CompactRulesCodec;
import org.compacttz.data.CompactRulesDocument;
import org.compacttz.data.HistoricalBlobWriter;
import org.compacttz.data.TzRuntimeConfig;
import org.compacttz.rules.CompactRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.zone.ZoneRules;
import java.time.zone.ZoneRulesProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compiles the embedded timezone resources from the JDK tz database.
 *
 * <p>Run during the build with the class output directory as its only argument; writes
 * {@code tzdata/compact-rules.flex} and {@code tzdata/historical.bin} below it.</p>
 */
public final class TzDataGenerator {
    private static final Logger log = LoggerFactory.getLogger(TzDataGenerator.class);
    static final String UTC = "UTC";

    private final GeneratorConfig config;
    private final ZoneRulesAnalyzer analyzer;

    /**
     * Creates a generator.
     *
     * @param config generation window and inputs.
     */
    public TzDataGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.analyzer = new ZoneRulesAnalyzer(config);
    }

    /**
     * Writes both resources below the given output directory.
     *
     * @param args {@code [outputDirectory]}, defaulting to {@code target/classes}.
     */
    public static void main(String[] args) throws IOException {
        Path outputDir = Paths.get(args.length > 0 ? args[0] : "target/classes");
        GeneratedTzData data = new TzDataGenerator(GeneratorConfig.defaults()).generate();
        write(outputDir.resolve(TzRuntimeConfig.DEFAULT_COMPACT_RULES_RESOURCE), data.getCompactRules());
        write(outputDir.resolve(TzRuntimeConfig.DEFAULT_HISTORICAL_RESOURCE), data.getHistorical());
        log.info("Wrote {} zones ({} always-historical, {} aliases) to {}: {} + {} bytes",
                data.getZones().size(), data.alwaysHistoricalCount(), data.getDocument().getAliases().size(),
                outputDir, data.getCompactRules().length, data.getHistorical().length);
    }

    /**
     * Builds the catalog, analyzes every zone and serializes both resources.
     *
     * @return generated data.
     */
    public GeneratedTzData generate() {
        Map<String, String> declaredAliases = loadAliases(config.getAliasesResource());
        Set<String> available = ZoneRulesProvider.getAvailableZoneIds();

        TreeSet<String> canonical = new TreeSet<>();
        for (String id : available) {
            if (!declaredAliases.containsKey(id) && isSelected(id)) {
                canonical.add(id);
            }
        }
        canonical.add(UTC);
        List<String> names = new ArrayList<>(canonical);

        Map<String, String> aliases = new TreeMap<>();
        for (Map.Entry<String, String> alias : declaredAliases.entrySet()) {
            String target = alias.getValue();
            if (canonical.contains(target) && !canonical.contains(alias.getKey())) {
                aliases.put(alias.getKey(), target);
            } else if (config.getZoneFilter().isEmpty()) {
                log.warn("Dropping alias {} -> {}: target is not a canonical zone", alias.getKey(), target);
            }
        }

        List<ZoneAnalysis> zones = new ArrayList<>(names.size());
        List<byte[]> sections = new ArrayList<>(names.size());
        for (String name : names) {
            ZoneAnalysis analysis = analyzer.analyze(name, rulesOf(name));
            zones.add(analysis);
            sections.add(analysis.getTable().toBytes());
        }

        List<CompactRuleSet> ruleSets = new ArrayList<>(zones.size());
        for (ZoneAnalysis zone : zones) {
            ruleSets.add(zone.getRules());
        }
        CompactRulesDocument document = new CompactRulesDocument(
                Collections.unmodifiableList(names),
                Collections.unmodifiableMap(aliases),
                Collections.unmodifiableList(ruleSets)
        );
        return new GeneratedTzData(
                document,
                CompactRulesCodec.encode(document),
                HistoricalBlobWriter.write(sections),
                Collections.unmodifiableList(zones)
        );
    }

    private boolean isSelected(String id) {
        return config.getZoneFilter().isEmpty() || config.getZoneFilter().contains(id);
    }

    private static ZoneRules rulesOf(String name) {
        if (UTC.equals(name)) {
            return ZoneOffset.UTC.getRules();
        }
        return ZoneRulesProvider.getRules(name, false);
    }

    /**
     * Reads the alias table; keys are alias names, values canonical names.
     */
    static Map<String, String> loadAliases(String resource) {
        Properties properties = new Properties();
        try (InputStream in = TzDataGenerator.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("alias table not found on classpath: " + resource);
            }
            properties.load(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read alias table " + resource, ex);
        }
        Map<String, String> aliases = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            aliases.put(key.trim(), properties.getProperty(key).trim());
        }
        return aliases;
    }

    private static void write(Path target, byte[] bytes) throws IOException {
        Files.createDirectories(target.getParent());
        Files.write(target, bytes);
    }
}
