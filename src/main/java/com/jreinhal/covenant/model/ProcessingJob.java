package com.jreinhal.covenant.model;

import java.time.Instant;

/**
 * In-memory record of a document currently held by an ingestion worker.
 * Absence means the document's state is whatever its stored status says.
 */
public record ProcessingJob(String documentId, DocumentStatus stage, Instant startedAt, String error) {

    public static ProcessingJob started(String documentId, Instant now) {
        return new ProcessingJob(documentId, DocumentStatus.PENDING, now, null);
    }

    public ProcessingJob withStage(DocumentStatus next) {
        return new ProcessingJob(this.documentId, next, this.startedAt, this.error);
    }

    public ProcessingJob withError(String message) {
        return new ProcessingJob(this.documentId, DocumentStatus.FAILED, this.startedAt, message);
    }
}
