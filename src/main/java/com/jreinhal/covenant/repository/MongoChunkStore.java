package com.jreinhal.covenant.repository;

import com.jreinhal.covenant.model.DocumentChunk;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class MongoChunkStore implements ChunkStore {
    private static final Logger log = LoggerFactory.getLogger(MongoChunkStore.class);

    private final DocumentChunkRepository repository;

    public MongoChunkStore(DocumentChunkRepository repository) {
        this.repository = repository;
    }

    @Override
    public void saveAll(List<DocumentChunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        this.repository.saveAll(chunks);
        log.debug("Persisted {} chunks", chunks.size());
    }

    @Override
    public List<DocumentChunk> findByDocumentId(String documentId) {
        return this.repository.findByDocumentIdOrderByChunkIndexAsc(documentId);
    }

    @Override
    public List<DocumentChunk> findByIds(Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return List.of();
        }
        return this.repository.findAllById(chunkIds);
    }

    @Override
    public long deleteByDocumentId(String documentId) {
        return this.repository.deleteByDocumentId(documentId);
    }

    @Override
    public long countByDocumentId(String documentId) {
        return this.repository.countByDocumentId(documentId);
    }
}
