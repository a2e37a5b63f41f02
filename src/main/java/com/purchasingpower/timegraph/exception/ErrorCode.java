package com.purchasingpower.timegraph.exception;

/**
 * Stable error codes for the temporal graph engine.
 *
 * <p>Codes are surfaced verbatim to whatever process boundary wraps the engine, so they must not
 * be renamed once published.
 *
 * @since 1.0.0
 */
public enum ErrorCode {
    NOT_FOUND,
    DUPLICATE_DOCUMENT,
    UNKNOWN_DOCUMENT,
    INCOMPARABLE_TIMESTAMP,
    NO_PATH,
    INVALID_ARGUMENT,
    SERIALIZATION_ERROR
}
