package com.jreinhal.covenant.ingest;

import com.jreinhal.covenant.exception.DocumentBusyException;
import com.jreinhal.covenant.exception.DocumentNotFoundException;
import com.jreinhal.covenant.exception.DuplicateDocumentException;
import com.jreinhal.covenant.exception.EmbeddingException;
import com.jreinhal.covenant.exception.ExtractionException;
import com.jreinhal.covenant.exception.IndexWriteException;
import com.jreinhal.covenant.exception.IngestionCancelledException;
import com.jreinhal.covenant.index.DualIndexWriter;
import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.ContractMetadata;
import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.model.DocumentType;
import com.jreinhal.covenant.model.ExtractedDocument;
import com.jreinhal.covenant.model.IngestionProgress;
import com.jreinhal.covenant.model.ProcessingJob;
import com.jreinhal.covenant.rag.chunking.ContractMetadataExtractor;
import com.jreinhal.covenant.rag.chunking.SlidingWindowChunker;
import com.jreinhal.covenant.repository.ChunkStore;
import com.jreinhal.covenant.repository.DocumentContentStore;
import com.jreinhal.covenant.repository.DocumentStore;
import com.jreinhal.covenant.service.DocumentTextExtractor;
import com.jreinhal.covenant.service.EmbeddingGenerator;
import com.jreinhal.covenant.util.ContentHashes;
import com.jreinhal.covenant.util.LogSanitizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives documents through extraction, chunking, embedding and indexing on the bounded
 * ingestion pool.
 *
 * <h2>Ownership</h2>
 * A document id is claimed in {@code inFlight} from the moment work is accepted until its
 * worker has finished, and every entry point claims before touching status. At most one
 * processor therefore ever works on a document, and a request for a claimed document is a
 * no-op ({@link #reprocess}, {@link #reprocessAll}) or a {@link DocumentBusyException}
 * ({@link #ingest}).
 *
 * <h2>Status</h2>
 * Every stage change is a conditional write on the stored status, so a document deleted
 * mid-flight cannot be moved back to a live state. INDEXED is written only after both indexes
 * hold every chunk. Stage failures are recorded on the document and never escape into the pool.
 *
 * <h2>Deletion</h2>
 * {@link #delete} writes the DELETED tombstone and purges index entries immediately. A worker
 * still holding the document sees the cancellation before its next write, removes whatever it
 * wrote, and the record itself is removed by whichever side finishes last.
 */
@Service
public class IngestionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);
    private static final Set<DocumentStatus> BULK_TARGETS = EnumSet.of(DocumentStatus.INDEXED, DocumentStatus.FAILED);
    private static final String QUEUE_FULL = "Ingestion queue is full; retry later";

    private final DocumentStore documentStore;
    private final ChunkStore chunkStore;
    private final DocumentContentStore contentStore;
    private final DocumentTextExtractor extractor;
    private final SlidingWindowChunker chunker;
    private final ContractMetadataExtractor metadataExtractor;
    private final EmbeddingGenerator embeddingGenerator;
    private final DualIndexWriter indexWriter;
    private final IngestionProgressTracker progress;
    private final Executor ingestionExecutor;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();
    private final Map<String, ProcessingJob> activeJobs = new ConcurrentHashMap<>();
    private final AtomicBoolean bulkRunning = new AtomicBoolean(false);

    public IngestionOrchestrator(DocumentStore documentStore, ChunkStore chunkStore, DocumentContentStore contentStore,
                                 DocumentTextExtractor extractor, SlidingWindowChunker chunker,
                                 ContractMetadataExtractor metadataExtractor, EmbeddingGenerator embeddingGenerator,
                                 DualIndexWriter indexWriter, IngestionProgressTracker progress,
                                 @Qualifier("ingestionExecutor") Executor ingestionExecutor) {
        this.documentStore = documentStore;
        this.chunkStore = chunkStore;
        this.contentStore = contentStore;
        this.extractor = extractor;
        this.chunker = chunker;
        this.metadataExtractor = metadataExtractor;
        this.embeddingGenerator = embeddingGenerator;
        this.indexWriter = indexWriter;
        this.progress = progress;
        this.ingestionExecutor = ingestionExecutor;
    }

    /**
     * Stores the bytes, records the document as PENDING and queues it. Returns without waiting
     * for processing; poll {@link #getStatus}.
     *
     * @param documentId caller-chosen id, or {@code null} to generate one; an existing id is
     *                   re-ingested with the new content
     * @throws DuplicateDocumentException when identical bytes are stored under another id
     * @throws DocumentBusyException when the id is being processed or deleted
     * @throws RejectedExecutionException when the ingestion queue is full
     */
    public ContractDocument ingest(String documentId, String filename, byte[] content, String declaredType) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Document content is empty");
        }
        String id = documentId == null || documentId.isBlank() ? UUID.randomUUID().toString() : documentId.strip();
        if (!LogSanitizer.isDocumentId(id)) {
            throw new IllegalArgumentException("Invalid document id: " + LogSanitizer.sanitize(id));
        }
        String contentHash = ContentHashes.sha256Hex(content);
        this.documentStore.findByContentHash(contentHash)
                .filter(existing -> !existing.getId().equals(id))
                .ifPresent(existing -> {
                    throw new DuplicateDocumentException(existing.getId());
                });
        if (!this.inFlight.add(id)) {
            throw new DocumentBusyException(id);
        }
        boolean submitted = false;
        try {
            Optional<ContractDocument> previous = this.documentStore.findById(id);
            if (previous.isPresent() && previous.get().getStatus() == DocumentStatus.DELETED) {
                throw new DocumentBusyException(id);
            }
            String contentRef = this.contentStore.store(id, filename, content);
            ContractDocument document = new ContractDocument(id, filename, declaredType, contentRef,
                    content.length, contentHash, Instant.now());
            previous.ifPresent(p -> document.setCreatedAt(p.getCreatedAt()));
            this.documentStore.save(document);
            previous.map(ContractDocument::getContentRef)
                    .filter(ref -> !ref.equals(contentRef))
                    .ifPresent(this.contentStore::delete);
            log.info(">> Accepted document for ingestion: {} ({} bytes)", LogSanitizer.sanitize(filename), content.length);
            this.submit(id);
            submitted = true;
            return document;
        } finally {
            if (!submitted) {
                this.inFlight.remove(id);
            }
        }
    }

    /**
     * Re-runs the pipeline for one document from PENDING.
     *
     * @return false when the document is already being processed
     */
    public boolean reprocess(String documentId) {
        ContractDocument document = this.documentStore.findById(documentId)
                .filter(d -> d.getStatus() != DocumentStatus.DELETED)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        if (!this.inFlight.add(documentId)) {
            log.info("Reprocess ignored: document already in progress");
            return false;
        }
        boolean submitted = false;
        try {
            if (!this.documentStore.resetForReprocess(documentId, DocumentStatus.REPROCESSABLE)) {
                log.info("Reprocess ignored: document is {}", document.getStatus());
                return false;
            }
            this.submit(documentId);
            submitted = true;
            return true;
        } finally {
            if (!submitted) {
                this.inFlight.remove(documentId);
            }
        }
    }

    /**
     * Reindexes every INDEXED and FAILED document as one job. All targets are first flipped to
     * EXTRACTING in a single write, then processed one at a time on one pool worker, each
     * committing its own terminal status.
     *
     * @return number of documents queued; 0 when a reindex is already running or nothing qualifies
     */
    public int reprocessAll() {
        if (!this.bulkRunning.compareAndSet(false, true)) {
            log.info("Reindex already running; request ignored");
            return 0;
        }
        List<String> claimed = new ArrayList<>();
        List<String> flipped = List.of();
        boolean submitted = false;
        try {
            this.documentStore.findByStatusIn(BULK_TARGETS).stream()
                    .sorted(Comparator.comparing(ContractDocument::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                    .map(ContractDocument::getId)
                    .filter(this.inFlight::add)
                    .forEach(claimed::add);
            flipped = this.documentStore.transitionAll(claimed, BULK_TARGETS, DocumentStatus.EXTRACTING);
            Set<String> moved = new HashSet<>(flipped);
            claimed.stream().filter(id -> !moved.contains(id)).forEach(this.inFlight::remove);
            if (flipped.isEmpty()) {
                log.info("Reindex requested but no documents qualify");
                return 0;
            }
            Instant now = Instant.now();
            for (String id : flipped) {
                this.activeJobs.put(id, ProcessingJob.started(id, now).withStage(DocumentStatus.EXTRACTING));
            }
            this.progress.enqueued(flipped);
            List<String> batch = flipped;
            this.ingestionExecutor.execute(() -> this.runBatch(batch));
            submitted = true;
            log.info(">> Reindex queued for {} documents", flipped.size());
            return flipped.size();
        } catch (RejectedExecutionException e) {
            for (String id : flipped) {
                this.release(id, QUEUE_FULL);
                this.documentStore.markFailed(id, QUEUE_FULL, null);
            }
            throw e;
        } finally {
            if (!submitted) {
                claimed.forEach(this.inFlight::remove);
                this.bulkRunning.set(false);
            }
        }
    }

    /**
     * Deletes the document, its chunks, index entries and stored bytes. Safe while the
     * document is being processed.
     */
    public void delete(String documentId) {
        if (this.documentStore.findById(documentId).isEmpty()) {
            throw new DocumentNotFoundException(documentId);
        }
        this.cancelled.add(documentId);
        this.documentStore.markDeleted(documentId);
        this.indexWriter.purge(documentId);
        this.chunkStore.deleteByDocumentId(documentId);
        if (!this.inFlight.contains(documentId)) {
            this.finalizeDeletion(documentId);
        } else {
            log.info("Document deleted while in progress; worker will finish the cleanup");
        }
    }

    /**
     * Current stored status. Always read from the document store.
     */
    public DocumentStatus getStatus(String documentId) {
        return this.getDocument(documentId).getStatus();
    }

    public ContractDocument getDocument(String documentId) {
        return this.documentStore.findById(documentId)
                .filter(d -> d.getStatus() != DocumentStatus.DELETED)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    public List<DocumentChunk> getChunks(String documentId) {
        this.getDocument(documentId);
        return this.chunkStore.findByDocumentId(documentId);
    }

    public IngestionProgress getProgress() {
        return this.progress.snapshot();
    }

    public List<ProcessingJob> getActiveJobs() {
        return this.activeJobs.values().stream()
                .sorted(Comparator.comparing(ProcessingJob::startedAt).thenComparing(ProcessingJob::documentId))
                .toList();
    }

    public boolean isReindexRunning() {
        return this.bulkRunning.get();
    }

    /**
     * Puts an unclaimed PENDING document back on the queue.
     *
     * @return false when it is already claimed
     */
    boolean resume(String documentId) {
        if (!this.inFlight.add(documentId)) {
            return false;
        }
        boolean submitted = false;
        try {
            this.submit(documentId);
            submitted = true;
            return true;
        } finally {
            if (!submitted) {
                this.inFlight.remove(documentId);
            }
        }
    }

    /**
     * Removes whatever a deleted document left behind when its deletion never completed.
     */
    void completeDeletion(String documentId) {
        this.cancelled.add(documentId);
        if (!this.inFlight.contains(documentId)) {
            this.indexWriter.purge(documentId);
            this.chunkStore.deleteByDocumentId(documentId);
            this.finalizeDeletion(documentId);
        }
    }

    private void submit(String documentId) {
        this.activeJobs.put(documentId, ProcessingJob.started(documentId, Instant.now()));
        this.progress.enqueued(List.of(documentId));
        try {
            this.ingestionExecutor.execute(() -> this.runWorker(documentId));
        } catch (RejectedExecutionException e) {
            this.release(documentId, QUEUE_FULL);
            this.documentStore.markFailed(documentId, QUEUE_FULL, null);
            throw e;
        }
    }

    private void runBatch(List<String> documentIds) {
        int next = 0;
        try {
            for (; next < documentIds.size(); next++) {
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                this.runWorker(documentIds.get(next));
            }
            log.info(">> Reindex finished: {} documents", documentIds.size());
        } finally {
            for (int i = next; i < documentIds.size(); i++) {
                String id = documentIds.get(i);
                String reason = "Reindex stopped before this document was processed";
                this.release(id, reason);
                this.documentStore.markFailed(id, reason, null);
            }
            this.bulkRunning.set(false);
        }
    }

    private void runWorker(String documentId) {
        MDC.put(LogSanitizer.DOCUMENT_ID_KEY, documentId);
        this.progress.started(documentId);
        String error = null;
        try {
            error = this.process(documentId);
        } finally {
            this.release(documentId, error);
            if (this.cancelled.contains(documentId)) {
                this.finalizeDeletion(documentId);
            }
            MDC.remove(LogSanitizer.DOCUMENT_ID_KEY);
        }
    }

    /**
     * @return failure reason, or {@code null} when the document was indexed or deleted
     */
    private String process(String documentId) {
        long startTime = System.currentTimeMillis();
        try {
            ContractDocument document = this.documentStore.findById(documentId)
                    .orElseThrow(() -> new IngestionCancelledException(documentId));
            this.advance(documentId, EnumSet.of(DocumentStatus.PENDING, DocumentStatus.EXTRACTING), DocumentStatus.EXTRACTING);
            byte[] content = this.contentStore.load(document.getContentRef());
            DocumentType type = this.extractor.resolveType(document.getDeclaredType(), document.getFilename(), content);
            ExtractedDocument extracted = this.extractor.extract(content, type, document.getFilename());
            this.documentStore.recordExtraction(documentId, type, extracted.pageCount(), extracted.textLength(),
                    extracted.ocrPageCount());

            this.advance(documentId, EnumSet.of(DocumentStatus.EXTRACTING), DocumentStatus.CHUNKING);
            List<DocumentChunk> chunks = this.chunker.chunk(documentId, extracted.pages());
            if (chunks.isEmpty()) {
                throw new ExtractionException("No text left to index after chunking");
            }
            ContractMetadata metadata = this.metadataExtractor.extract(SlidingWindowChunker.joinPages(extracted.pages()));
            this.documentStore.recordMetadata(documentId, metadata);
            this.checkCancelled(documentId);
            this.indexWriter.purge(documentId);
            this.chunkStore.deleteByDocumentId(documentId);
            this.chunkStore.saveAll(chunks);

            this.advance(documentId, EnumSet.of(DocumentStatus.CHUNKING), DocumentStatus.EMBEDDING);
            List<float[]> vectors = this.embeddingGenerator.embedChunks(chunks);
            this.indexWriter.write(documentId, chunks, vectors, () -> this.cancelled.contains(documentId));
            if (!this.documentStore.markIndexed(documentId, chunks.size())) {
                throw new IngestionCancelledException(documentId);
            }
            log.info(">> Document indexed: {} pages ({} via OCR), {} chunks in {}ms", extracted.pageCount(),
                    extracted.ocrPageCount(), chunks.size(), System.currentTimeMillis() - startTime);
            return null;
        } catch (IngestionCancelledException e) {
            log.info("Ingestion stopped: {}", e.getMessage());
            this.removeDerivedData(documentId);
            return null;
        } catch (ExtractionException e) {
            return this.fail(documentId, e.getMessage(), null, e);
        } catch (EmbeddingException e) {
            return this.fail(documentId, e.getMessage(), e.getChunkIndex() >= 0 ? e.getChunkIndex() : null, e);
        } catch (IndexWriteException e) {
            return this.fail(documentId, e.getMessage(), e.getChunkIndex(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected ingestion failure", e);
            return this.fail(documentId, "Unexpected error: " + e.getClass().getSimpleName(), null, e);
        }
    }

    private void advance(String documentId, Set<DocumentStatus> expected, DocumentStatus next) {
        this.checkCancelled(documentId);
        if (!this.documentStore.transition(documentId, expected, next)) {
            throw new IngestionCancelledException(documentId);
        }
        this.activeJobs.computeIfPresent(documentId, (id, job) -> job.withStage(next));
    }

    private void checkCancelled(String documentId) {
        if (this.cancelled.contains(documentId)) {
            throw new IngestionCancelledException(documentId);
        }
    }

    private String fail(String documentId, String reason, Integer chunkIndex, RuntimeException cause) {
        ProcessingJob job = this.activeJobs.get(documentId);
        log.warn("Ingestion failed{}: {}", job != null ? " during " + job.stage() : "", reason);
        this.activeJobs.computeIfPresent(documentId, (id, j) -> j.withError(reason));
        if (log.isDebugEnabled()) {
            log.debug("Ingestion failure detail", cause);
        }
        this.removeDerivedData(documentId);
        this.documentStore.markFailed(documentId, reason, chunkIndex);
        return reason;
    }

    private void removeDerivedData(String documentId) {
        try {
            this.indexWriter.purge(documentId);
            this.chunkStore.deleteByDocumentId(documentId);
        } catch (RuntimeException e) {
            log.error("Failed to remove chunks and index entries; reprocess will replace them", e);
        }
    }

    private void release(String documentId, String error) {
        this.activeJobs.remove(documentId);
        this.inFlight.remove(documentId);
        this.progress.finished(documentId, error);
    }

    private void finalizeDeletion(String documentId) {
        if (!this.cancelled.remove(documentId)) {
            return;
        }
        this.indexWriter.purge(documentId);
        this.chunkStore.deleteByDocumentId(documentId);
        this.documentStore.findById(documentId).ifPresent(document -> this.contentStore.delete(document.getContentRef()));
        this.documentStore.deleteById(documentId);
        log.info("Document deleted");
    }
}
