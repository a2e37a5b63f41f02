package com.purchasingpower.timegraph.exception;

import java.util.Map;

/** Failure converting engine types to or from their JSON interchange form. */
public class SerializationException extends TemporalGraphException {

    public SerializationException(String message, Throwable cause) {
        super(ErrorCode.SERIALIZATION_ERROR, message, Map.of(), cause);
    }
}
