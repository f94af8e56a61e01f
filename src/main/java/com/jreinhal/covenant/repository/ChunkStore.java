package com.jreinhal.covenant.repository;

import com.jreinhal.covenant.model.DocumentChunk;
import java.util.Collection;
import java.util.List;

public interface ChunkStore {

    void saveAll(List<DocumentChunk> chunks);

    /**
     * Chunks of one document in ordinal order.
     */
    List<DocumentChunk> findByDocumentId(String documentId);

    List<DocumentChunk> findByIds(Collection<String> chunkIds);

    long deleteByDocumentId(String documentId);

    long countByDocumentId(String documentId);
}
