package com.knowledgeassist.api.service.ingestion;

/**
 * Raised when an uploaded document cannot be ingested because of its own content (empty, undecodable, produced no
 * chunks). Always a client error.
 */
public class DocumentRejectedException extends RuntimeException {

    public DocumentRejectedException(String message) {
        super(message);
    }

    public DocumentRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
