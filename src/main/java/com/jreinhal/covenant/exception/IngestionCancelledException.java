package com.jreinhal.covenant.exception;

/**
 * Thrown inside a worker once it observes that its document was deleted.
 */
public class IngestionCancelledException extends RuntimeException {
    public IngestionCancelledException(String documentId) {
        super("Ingestion cancelled, document deleted: " + documentId);
    }
}
