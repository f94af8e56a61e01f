package com.jreinhal.covenant.repository;

import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.ContractMetadata;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.model.DocumentType;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable document records and their status.
 *
 * <p>Every read goes to the backing store; implementations must not serve status from a cache
 * or identity map, because a status poll has to see the latest committed transition.
 * Status writes are conditional on the current status so that a concurrent deletion or a
 * second processor can never be overwritten.</p>
 */
public interface DocumentStore {

    void save(ContractDocument document);

    Optional<ContractDocument> findById(String id);

    Optional<ContractDocument> findByContentHash(String contentHash);

    List<ContractDocument> findByStatusIn(Collection<DocumentStatus> statuses);

    /**
     * Current status of each listed document that still exists.
     */
    Map<String, DocumentStatus> findStatuses(Collection<String> ids);

    /**
     * @return true when the document was in one of {@code expected} and now has {@code next}
     */
    boolean transition(String id, Set<DocumentStatus> expected, DocumentStatus next);

    /**
     * Moves every listed document currently in one of {@code expected} to {@code next} in a
     * single write.
     *
     * @return ids that were actually moved
     */
    List<String> transitionAll(Collection<String> ids, Set<DocumentStatus> expected, DocumentStatus next);

    boolean recordExtraction(String id, DocumentType documentType, int pageCount, int textLength, int ocrPageCount);

    /**
     * Replaces the document's metadata while it is CHUNKING.
     */
    boolean recordMetadata(String id, ContractMetadata metadata);

    /**
     * EMBEDDING to INDEXED, clearing any previous failure.
     */
    boolean markIndexed(String id, int chunkCount);

    /**
     * Any non-deleted status to FAILED.
     */
    boolean markFailed(String id, String reason, Integer failedChunkIndex);

    /**
     * Back to PENDING for a new pass, clearing failure details.
     */
    boolean resetForReprocess(String id, Set<DocumentStatus> expected);

    boolean markDeleted(String id);

    void deleteById(String id);
}
