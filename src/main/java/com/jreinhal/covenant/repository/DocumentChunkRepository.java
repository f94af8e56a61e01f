package com.jreinhal.covenant.repository;

import com.jreinhal.covenant.model.DocumentChunk;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DocumentChunkRepository extends MongoRepository<DocumentChunk, String> {

    List<DocumentChunk> findByDocumentIdOrderByChunkIndexAsc(String documentId);

    long deleteByDocumentId(String documentId);

    long countByDocumentId(String documentId);
}
