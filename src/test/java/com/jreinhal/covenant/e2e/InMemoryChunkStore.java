package com.jreinhal.covenant.e2e;

import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.repository.ChunkStore;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryChunkStore implements ChunkStore {
    private final Map<String, DocumentChunk> chunks = new ConcurrentHashMap<>();

    @Override
    public void saveAll(List<DocumentChunk> toSave) {
        toSave.forEach(chunk -> this.chunks.put(chunk.getId(), chunk));
    }

    @Override
    public List<DocumentChunk> findByDocumentId(String documentId) {
        return this.chunks.values().stream()
                .filter(c -> documentId.equals(c.getDocumentId()))
                .sorted(Comparator.comparingInt(DocumentChunk::getChunkIndex))
                .toList();
    }

    @Override
    public List<DocumentChunk> findByIds(Collection<String> chunkIds) {
        return chunkIds.stream().map(this.chunks::get).filter(Objects::nonNull).toList();
    }

    @Override
    public long deleteByDocumentId(String documentId) {
        List<String> ids = this.chunks.values().stream()
                .filter(c -> documentId.equals(c.getDocumentId()))
                .map(DocumentChunk::getId)
                .toList();
        ids.forEach(this.chunks::remove);
        return ids.size();
    }

    @Override
    public long countByDocumentId(String documentId) {
        return this.chunks.values().stream().filter(c -> documentId.equals(c.getDocumentId())).count();
    }

    public int size() {
        return this.chunks.size();
    }
}
