package com.purchasingpower.timegraph.exception;

import java.util.Map;

/** Insert attempted with an id that is already taken. */
public class DuplicateDocumentException extends TemporalGraphException {

    public DuplicateDocumentException(String documentId) {
        super(ErrorCode.DUPLICATE_DOCUMENT, "Document already exists: " + documentId,
                Map.of("documentId", documentId));
    }
}
