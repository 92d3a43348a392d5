package org.compacttz.data;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.compacttz.core.id.NameCatalog;
import org.compacttz.rules.CompactRuleRegistry;

import java.util.Objects;

/**
 * Embedded data resolved from the classpath: catalog and compact rules eagerly, historical
 * sections lazily.
 */
@Getter
@Accessors(fluent = true)
public final class EmbeddedTzData {
    private final NameCatalog catalog;
    private final CompactRuleRegistry rules;
    private final TzDataSource historicalSource;

    private EmbeddedTzData(NameCatalog catalog, CompactRuleRegistry rules, TzDataSource historicalSource) {
        this.catalog = catalog;
        this.rules = rules;
        this.historicalSource = historicalSource;
    }

    /**
     * Reads the compact-rules document and prepares the lazy historical source.
     *
     * @param config resource locations.
     * @return resolved embedded data.
     * @throws CorruptEmbeddedDataException If the compact-rules resource is missing or malformed.
     */
    public static EmbeddedTzData open(TzRuntimeConfig config) {
        Objects.requireNonNull(config, "config");
        ClassLoader loader = config.effectiveClassLoader();
        CompactRulesDocument document = CompactRulesCodec.decode(
                ClasspathResources.read(loader, config.getCompactRulesResource())
        );
        NameCatalog catalog;
        try {
            catalog = document.toCatalog();
        } catch (IllegalArgumentException ex) {
            throw new CorruptEmbeddedDataException(
                    CorruptEmbeddedDataException.REASON_MALFORMED_RULES,
                    "compact rules catalog is inconsistent: " + ex.getMessage(),
                    ex
            );
        }
        TzDataSource historical = new ClasspathHistoricalSource(loader, config.getHistoricalResource(), catalog.size());
        return new EmbeddedTzData(catalog, document.toRegistry(), historical);
    }
}
