package com.jreinhal.covenant.index;

import java.util.List;

/**
 * Term-matching store of chunk text.
 */
public interface LexicalIndex {

    void upsert(String chunkId, String documentId, String text);

    /**
     * @param documentId restricts the search to one document when not {@code null}
     * @return at most {@code k} hits with a positive score, ordered by descending score
     */
    List<LexicalHit> query(String text, int k, String documentId);

    long deleteByDocument(String documentId);

    long countByDocument(String documentId);

    record LexicalHit(String chunkId, String documentId, double score) {
    }
}
