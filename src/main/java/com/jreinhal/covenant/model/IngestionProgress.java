package com.jreinhal.covenant.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable progress snapshot. A new instance replaces the old one on every change,
 * so a reader holding a reference always sees one consistent state.
 *
 * @param total documents accepted into the current run
 * @param completed documents that reached a terminal state in the current run
 * @param currentDocuments documents a worker holds right now
 * @param errors one entry per failed document, "documentId: reason"
 * @param running false before the first run and after the last accepted document finished
 */
public record IngestionProgress(int total, int completed, List<String> currentDocuments, List<String> errors,
                                boolean running, Instant startedAt, Instant finishedAt) {

    private static final IngestionProgress IDLE = new IngestionProgress(0, 0, List.of(), List.of(), false, null, null);

    public IngestionProgress {
        currentDocuments = List.copyOf(currentDocuments);
        errors = List.copyOf(errors);
    }

    public static IngestionProgress idle() {
        return IDLE;
    }

    public String currentDocument() {
        return this.currentDocuments.isEmpty() ? null : this.currentDocuments.get(0);
    }
}
