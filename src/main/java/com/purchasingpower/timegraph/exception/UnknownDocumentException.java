package com.purchasingpower.timegraph.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A relationship endpoint does not exist. Distinct from {@link DocumentNotFoundException} so
 * callers can tell a bad edge from a bad lookup.
 */
public class UnknownDocumentException extends TemporalGraphException {

    public UnknownDocumentException(String fromId, String toId, String missingId) {
        super(ErrorCode.UNKNOWN_DOCUMENT,
                "Cannot create relationship " + fromId + " -> " + toId + ": unknown document " + missingId,
                context(fromId, toId, missingId));
    }

    private static Map<String, Object> context(String fromId, String toId, String missingId) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("from", fromId);
        context.put("to", toId);
        context.put("missing", missingId);
        return context;
    }
}
