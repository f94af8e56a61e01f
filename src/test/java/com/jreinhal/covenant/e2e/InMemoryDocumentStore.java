package com.jreinhal.covenant.e2e;

import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.ContractMetadata;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.model.DocumentType;
import com.jreinhal.covenant.repository.DocumentStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Document store backed by a map. Reads return copies, so callers see a snapshot the way
 * they would after a database round trip.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private final Map<String, ContractDocument> documents = new LinkedHashMap<>();

    @Override
    public synchronized void save(ContractDocument document) {
        document.setUpdatedAt(Instant.now());
        this.documents.put(document.getId(), copy(document));
    }

    @Override
    public synchronized Optional<ContractDocument> findById(String id) {
        return Optional.ofNullable(this.documents.get(id)).map(InMemoryDocumentStore::copy);
    }

    @Override
    public synchronized Optional<ContractDocument> findByContentHash(String contentHash) {
        return this.documents.values().stream()
                .filter(d -> contentHash.equals(d.getContentHash()) && d.getStatus() != DocumentStatus.DELETED)
                .findFirst()
                .map(InMemoryDocumentStore::copy);
    }

    @Override
    public synchronized List<ContractDocument> findByStatusIn(Collection<DocumentStatus> statuses) {
        return this.documents.values().stream()
                .filter(d -> statuses.contains(d.getStatus()))
                .map(InMemoryDocumentStore::copy)
                .toList();
    }

    @Override
    public synchronized Map<String, DocumentStatus> findStatuses(Collection<String> ids) {
        Map<String, DocumentStatus> statuses = new LinkedHashMap<>();
        for (String id : ids) {
            ContractDocument document = this.documents.get(id);
            if (document != null) {
                statuses.put(id, document.getStatus());
            }
        }
        return statuses;
    }

    @Override
    public synchronized boolean transition(String id, Set<DocumentStatus> expected, DocumentStatus next) {
        ContractDocument document = this.documents.get(id);
        if (document == null || !expected.contains(document.getStatus())) {
            return false;
        }
        document.setStatus(next);
        document.setUpdatedAt(Instant.now());
        return true;
    }

    @Override
    public synchronized List<String> transitionAll(Collection<String> ids, Set<DocumentStatus> expected, DocumentStatus next) {
        List<String> moved = new ArrayList<>();
        for (String id : ids) {
            if (this.transition(id, expected, next)) {
                moved.add(id);
            }
        }
        return moved;
    }

    @Override
    public synchronized boolean recordExtraction(String id, DocumentType documentType, int pageCount, int textLength,
                                                 int ocrPageCount) {
        ContractDocument document = this.documents.get(id);
        if (document == null || document.getStatus() != DocumentStatus.EXTRACTING) {
            return false;
        }
        document.setDocumentType(documentType);
        document.setPageCount(pageCount);
        document.setTextLength(textLength);
        document.setOcrPageCount(ocrPageCount);
        return true;
    }

    @Override
    public synchronized boolean recordMetadata(String id, ContractMetadata metadata) {
        ContractDocument document = this.documents.get(id);
        if (document == null || document.getStatus() != DocumentStatus.CHUNKING) {
            return false;
        }
        document.setMetadata(metadata);
        return true;
    }

    @Override
    public synchronized boolean markIndexed(String id, int chunkCount) {
        ContractDocument document = this.documents.get(id);
        if (document == null || document.getStatus() != DocumentStatus.EMBEDDING) {
            return false;
        }
        document.setStatus(DocumentStatus.INDEXED);
        document.setChunkCount(chunkCount);
        document.setIndexedAt(Instant.now());
        document.setFailureReason(null);
        document.setFailedChunkIndex(null);
        return true;
    }

    @Override
    public synchronized boolean markFailed(String id, String reason, Integer failedChunkIndex) {
        ContractDocument document = this.documents.get(id);
        if (document == null || document.getStatus() == DocumentStatus.DELETED) {
            return false;
        }
        document.setStatus(DocumentStatus.FAILED);
        document.setFailureReason(reason);
        document.setFailedChunkIndex(failedChunkIndex);
        document.setChunkCount(0);
        return true;
    }

    @Override
    public synchronized boolean resetForReprocess(String id, Set<DocumentStatus> expected) {
        ContractDocument document = this.documents.get(id);
        if (document == null || !expected.contains(document.getStatus())) {
            return false;
        }
        document.setStatus(DocumentStatus.PENDING);
        document.setFailureReason(null);
        document.setFailedChunkIndex(null);
        return true;
    }

    @Override
    public synchronized boolean markDeleted(String id) {
        return this.transition(id, EnumSet.complementOf(EnumSet.of(DocumentStatus.DELETED)), DocumentStatus.DELETED);
    }

    @Override
    public synchronized void deleteById(String id) {
        this.documents.remove(id);
    }

    public synchronized int size() {
        return this.documents.size();
    }

    /**
     * Writes a status directly, bypassing the transition rules.
     */
    public synchronized void forceStatus(String id, DocumentStatus status) {
        this.documents.get(id).setStatus(status);
    }

    private static ContractDocument copy(ContractDocument source) {
        ContractDocument copy = new ContractDocument(source.getId(), source.getFilename(), source.getDeclaredType(),
                source.getContentRef(), source.getSizeBytes(), source.getContentHash(), source.getCreatedAt());
        copy.setStatus(source.getStatus());
        copy.setDocumentType(source.getDocumentType());
        copy.setPageCount(source.getPageCount());
        copy.setTextLength(source.getTextLength());
        copy.setOcrPageCount(source.getOcrPageCount());
        copy.setChunkCount(source.getChunkCount());
        copy.setFailureReason(source.getFailureReason());
        copy.setFailedChunkIndex(source.getFailedChunkIndex());
        copy.setUpdatedAt(source.getUpdatedAt());
        copy.setIndexedAt(source.getIndexedAt());
        copy.setMetadata(source.getMetadata());
        return copy;
    }
}
