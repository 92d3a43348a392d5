package org.compacttz.generator;

import org.compacttz.core.id.NameCatalog;
import org.compacttz.data.CompactRulesCodec;
import org.compacttz.data.CompactRulesDocument;
import org.compacttz.data.HistoricalBlob;
import org.compacttz.historical.ZstdTransitionTableLoader;
import org.compacttz.tz.Tz;
import org.compacttz.tz.TzDatabase;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TzDataGeneratorTest {

    private static final List<String> ZONES = List.of(
            "Africa/Casablanca", "America/New_York", "America/Santiago", "Asia/Tokyo", "Australia/Sydney", "Europe/London"
    );

    private static GeneratedTzData generated;

    @BeforeAll
    static void generate() {
        GeneratorConfig.GeneratorConfigBuilder builder = GeneratorConfig.defaults().toBuilder();
        ZONES.forEach(builder::zone);
        generated = new TzDataGenerator(builder.build()).generate();
    }

    @Test
    @DisplayName("Catalog holds the selected zones plus UTC, sorted, with aliases to selected zones only")
    void testCatalog() {
        CompactRulesDocument document = generated.getDocument();
        List<String> names = document.getCanonicalNames();
        assertEquals(ZONES.size() + 1, names.size());
        assertTrue(names.contains("UTC"));
        assertEquals(names.stream().sorted().toList(), names);

        Map<String, String> aliases = document.getAliases();
        assertEquals("America/New_York", aliases.get("US/Eastern"));
        assertEquals("UTC", aliases.get("Etc/UTC"));
        assertEquals("Europe/London", aliases.get("GB"));
        assertFalse(aliases.containsKey("US/Pacific"));
    }

    @Test
    @DisplayName("Serialized resources decode back to the generated document")
    void testResourcesDecode() {
        CompactRulesDocument decoded = CompactRulesCodec.decode(generated.getCompactRules());
        assertEquals(generated.getDocument().getCanonicalNames(), decoded.getCanonicalNames());
        assertEquals(generated.getDocument().getAliases(), decoded.getAliases());
        assertEquals(generated.getDocument().getRules(), decoded.getRules());

        HistoricalBlob blob = HistoricalBlob.parse(generated.getHistorical(), decoded.getCanonicalNames().size());
        assertEquals(decoded.getCanonicalNames().size(), blob.zoneCount());
        assertTrue(generated.alwaysHistoricalCount() >= 1);
    }

    @Test
    @DisplayName("A database over freshly generated data matches the reference hourly through 2030")
    void testGeneratedDataParity() {
        CompactRulesDocument document = CompactRulesCodec.decode(generated.getCompactRules());
        NameCatalog catalog = document.toCatalog();
        HistoricalBlob blob = HistoricalBlob.parse(generated.getHistorical(), catalog.size());
        TzDatabase db = TzDatabase.of(catalog, document.toRegistry(), new ZstdTransitionTableLoader(blob, 1 << 20));

        long from = 0L;
        long to = 1924991999L; // 2030-12-31T23:59:59Z
        for (String name : ZONES) {
            Tz tz = db.parse(name);
            var rules = ZoneId.of(name).getRules();
            for (long ts = from; ts <= to; ts += 3600L * 7) {
                int expected = rules.getOffset(Instant.ofEpochSecond(ts)).getTotalSeconds() / 60;
                assertEquals(expected, tz.offsetAtTimestamp(ts), name + " @" + ts);
            }
        }
    }

    @Test
    @DisplayName("Main writes both resources below the output directory")
    void testMainWritesResources() throws Exception {
        Path dir = Files.createTempDirectory("tzdata");
        TzDataGenerator.main(new String[]{dir.toString()});
        assertTrue(Files.size(dir.resolve("tzdata/compact-rules.flex")) > 0);
        assertTrue(Files.size(dir.resolve("tzdata/historical.bin")) > 0);
    }

    @Test
    @DisplayName("Alias table contains the legacy names and the UTC family")
    void testAliasTable() {
        Map<String, String> aliases = TzDataGenerator.loadAliases(GeneratorConfig.DEFAULT_ALIASES_RESOURCE);
        assertEquals("America/New_York", aliases.get("US/Eastern"));
        assertEquals("UTC", aliases.get("Zulu"));
        assertThrows(IllegalStateException.class, () -> TzDataGenerator.loadAliases("tzdata-source/missing.properties"));
    }
}
