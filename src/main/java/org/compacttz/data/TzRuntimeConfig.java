package org.compacttz.data;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration used to locate and bound the embedded timezone data.
 */
@Value
@Builder(toBuilder = true)
public class TzRuntimeConfig {
    public static final String DEFAULT_COMPACT_RULES_RESOURCE = "tzdata/compact-rules.flex";
    public static final String DEFAULT_HISTORICAL_RESOURCE = "tzdata/historical.bin";
    public static final int DEFAULT_MAX_DECOMPRESSED_BYTES = 1 << 20;

    public static final String PROPERTY_COMPACT_RULES = "compacttz.compactRules";
    public static final String PROPERTY_HISTORICAL = "compacttz.historical";
    public static final String PROPERTY_MAX_DECOMPRESSED_BYTES = "compacttz.maxDecompressedBytes";

    /** Classpath location of the FlexBuffers compact-rules document. */
    @Builder.Default
    String compactRulesResource = DEFAULT_COMPACT_RULES_RESOURCE;

    /** Classpath location of the zstd historical container. */
    @Builder.Default
    String historicalResource = DEFAULT_HISTORICAL_RESOURCE;

    /**
     * Upper bound for one decompressed historical table.
     *
     * <p>A frame declaring more than this is rejected as corrupt.</p>
     */
    @Builder.Default
    int maxDecompressedBytes = DEFAULT_MAX_DECOMPRESSED_BYTES;

    /** Loader used for resource lookups; {@code null} means this library's own loader. */
    ClassLoader classLoader;

    /**
     * Returns the configuration of the bundled data.
     */
    public static TzRuntimeConfig defaults() {
        return TzRuntimeConfig.builder().build();
    }

    /**
     * Returns bundled defaults overridden by {@code compacttz.*} system properties.
     *
     * <p>Blank or unparsable values keep the default.</p>
     */
    public static TzRuntimeConfig fromSystemProperties() {
        return TzRuntimeConfig.builder()
                .compactRulesResource(readString(PROPERTY_COMPACT_RULES, DEFAULT_COMPACT_RULES_RESOURCE))
                .historicalResource(readString(PROPERTY_HISTORICAL, DEFAULT_HISTORICAL_RESOURCE))
                .maxDecompressedBytes(readPositiveInt(PROPERTY_MAX_DECOMPRESSED_BYTES, DEFAULT_MAX_DECOMPRESSED_BYTES))
                .build();
    }

    /**
     * Returns the configured loader, falling back to this library's loader.
     */
    public ClassLoader effectiveClassLoader() {
        return classLoader != null ? classLoader : TzRuntimeConfig.class.getClassLoader();
    }

    private static String readString(String property, String fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static int readPositiveInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
