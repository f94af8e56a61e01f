package com.jreinhal.covenant.index;

import java.util.List;

/**
 * Nearest-neighbour store of chunk embeddings.
 *
 * <p>One entry per chunk id; {@link #upsert} replaces an existing entry. Distances are cosine
 * distances in {@code [0, 2]}, lower meaning more similar.</p>
 */
public interface VectorIndex {

    void upsert(String chunkId, String documentId, float[] vector);

    /**
     * @param documentId restricts the search to one document when not {@code null}
     * @return at most {@code k} hits ordered by ascending distance
     */
    List<VectorHit> query(float[] vector, int k, String documentId);

    long deleteByDocument(String documentId);

    long countByDocument(String documentId);

    record VectorHit(String chunkId, String documentId, double distance) {
    }
}
