package org.tzguard.core;

/**
 * Raised when a timezone identifier is not recognized, or when no timezone is available at all.
 */
public final class UnknownTimezoneException extends TimestampException {

    public UnknownTimezoneException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public UnknownTimezoneException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
