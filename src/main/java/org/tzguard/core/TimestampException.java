package org.tzguard.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Timestamp contract exception with deterministic reason codes.
 *
 * <p>Subclasses distinguish the two failure kinds surfaced to callers: malformed input
 * ({@link TimestampFormatException}) and unrecognized timezones ({@link UnknownTimezoneException}).</p>
 */
@Getter
@Accessors(fluent = true)
public class TimestampException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded timestamp failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public TimestampException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded timestamp failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public TimestampException(String reasonCode, String message, Throwable cause) {
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
