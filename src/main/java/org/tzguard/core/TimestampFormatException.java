package org.tzguard.core;

/**
 * Raised when input text or a format pattern cannot be turned into a timestamp.
 */
public final class TimestampFormatException extends TimestampException {

    public TimestampFormatException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public TimestampFormatException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
