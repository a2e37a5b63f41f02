package com.purchasingpower.timegraph.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the engine: a machine-friendly {@link ErrorCode} plus a
 * human-friendly message and optional diagnostic context (document ids, timestamps).
 *
 * @since 1.0.0
 */
@Getter
public class TemporalGraphException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> context;

    public TemporalGraphException(ErrorCode code, String message) {
        this(code, message, Collections.emptyMap(), null);
    }

    public TemporalGraphException(ErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public TemporalGraphException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
