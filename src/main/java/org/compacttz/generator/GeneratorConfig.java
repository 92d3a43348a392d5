package org.compacttz.generator;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Build-time configuration of the embedded data generator.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {
    public static final String DEFAULT_ALIASES_RESOURCE = "tzdata-source/aliases.properties";

    /** First year covered by historical tables; earlier instants clamp to its first offset. */
    @Builder.Default
    int startYear = 1970;

    /** Historical tables record every transition through the end of this year. */
    @Builder.Default
    int endYear = 2025;

    /** Compact rules are verified through the end of this year. */
    @Builder.Default
    int horizonYear = 2040;

    /** Zones routed to historical tables regardless of their recurring rules. */
    @Singular
    Set<String> alwaysHistoricalZones;

    /** Classpath location of the alias table. */
    @Builder.Default
    String aliasesResource = DEFAULT_ALIASES_RESOURCE;

    /** Canonical names to generate; empty means every zone the JDK knows. */
    @Singular("zone")
    Set<String> zoneFilter;

    /**
     * Returns the configuration used for the bundled data.
     */
    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder()
                .alwaysHistoricalZone("Africa/Casablanca")
                .alwaysHistoricalZone("Africa/El_Aaiun")
                .build();
    }

    /**
     * Validates the year window.
     *
     * @throws IllegalArgumentException If the years are out of order.
     */
    public GeneratorConfig validate() {
        if (startYear > endYear || endYear > horizonYear) {
            throw new IllegalArgumentException(
                    "years must satisfy startYear <= endYear <= horizonYear, got "
                            + startYear + ", " + endYear + ", " + horizonYear
            );
        }
        if (aliasesResource == null || aliasesResource.isBlank()) {
            throw new IllegalArgumentException("aliasesResource must be non-blank");
        }
        return this;
    }
}
