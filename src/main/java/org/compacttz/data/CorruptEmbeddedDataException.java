package org.compacttz.data;

import lombok.Getter;

import java.util.Objects;

/**
 * Embedded timezone data failed to decode. Signals a packaging defect, never bad user input.
 *
 * <p>Retrying cannot succeed because the embedded bytes are immutable; callers may treat this as
 * fatal.</p>
 */
@Getter
public final class CorruptEmbeddedDataException extends RuntimeException {
    public static final String REASON_MISSING_RESOURCE = "MISSING_RESOURCE";
    public static final String REASON_BAD_MAGIC = "BAD_MAGIC";
    public static final String REASON_UNSUPPORTED_VERSION = "UNSUPPORTED_VERSION";
    public static final String REASON_ZONE_COUNT_MISMATCH = "ZONE_COUNT_MISMATCH";
    public static final String REASON_INDEX_OUT_OF_BOUNDS = "INDEX_OUT_OF_BOUNDS";
    public static final String REASON_DECOMPRESSION_FAILED = "DECOMPRESSION_FAILED";
    public static final String REASON_LENGTH_MISMATCH = "LENGTH_MISMATCH";
    public static final String REASON_UNORDERED_TRANSITIONS = "UNORDERED_TRANSITIONS";
    public static final String REASON_EMPTY_TABLE = "EMPTY_TABLE";
    public static final String REASON_MALFORMED_RULES = "MALFORMED_RULES";

    private final String reasonCode;

    /**
     * Creates a reason-coded data failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public CorruptEmbeddedDataException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded data failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public CorruptEmbeddedDataException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
