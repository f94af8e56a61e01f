package com.jreinhal.covenant.model;

/**
 * Pointer from an answer back to supporting text. Spans use the same absolute offsets as
 * {@link DocumentChunk}.
 */
public record Citation(String documentId, int pageNum, String clauseNumber, int spanStart, int spanEnd,
                       String excerpt, String chunkId, MatchMethod matchMethod) {

    public enum MatchMethod {
        EXACT,
        NORMALIZED,
        FUZZY,
        MODEL_ASSISTED,
        WHOLE_EXCERPT,
        // Fact read from the contract at ingestion; no model output involved
        METADATA
    }
}
