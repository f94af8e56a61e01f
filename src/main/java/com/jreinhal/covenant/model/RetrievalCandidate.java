package com.jreinhal.covenant.model;

/**
 * One fused search result. Ranks are 1-based; 0 means the chunk was absent from that list,
 * in which case the matching raw score is {@code null} (vector) or {@code 0} (lexical).
 */
public record RetrievalCandidate(DocumentChunk chunk, Double vectorDistance, double lexicalScore,
                                 int vectorRank, int lexicalRank, double fusedScore, int fusedRank) {

    public String chunkId() {
        return this.chunk.getId();
    }

    public String documentId() {
        return this.chunk.getDocumentId();
    }
}
