package com.purchasingpower.timegraph.exception;

import java.util.Map;

/** Requested document id is not in the store. */
public class DocumentNotFoundException extends TemporalGraphException {

    public DocumentNotFoundException(String documentId) {
        super(ErrorCode.NOT_FOUND, "Document not found: " + documentId, Map.of("documentId", documentId));
    }
}
