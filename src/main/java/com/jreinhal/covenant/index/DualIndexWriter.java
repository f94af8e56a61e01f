package com.jreinhal.covenant.index;

import com.jreinhal.covenant.exception.IndexWriteException;
import com.jreinhal.covenant.exception.IngestionCancelledException;
import com.jreinhal.covenant.model.DocumentChunk;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one document's chunks into both indexes, all or nothing.
 *
 * <p>Cancellation is checked before every chunk and once more after the last one. On
 * cancellation or on any write failure every entry of the document is removed from both
 * indexes before the exception leaves this class.</p>
 */
@Component
public class DualIndexWriter {
    private static final Logger log = LoggerFactory.getLogger(DualIndexWriter.class);

    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;

    public DualIndexWriter(VectorIndex vectorIndex, LexicalIndex lexicalIndex) {
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
    }

    /**
     * @param cancelled polled before each write; true once the document has been deleted
     * @return number of chunks written
     */
    public int write(String documentId, List<DocumentChunk> chunks, List<float[]> vectors, BooleanSupplier cancelled) {
        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("Expected " + chunks.size() + " vectors, got " + vectors.size());
        }
        for (int i = 0; i < chunks.size(); i++) {
            DocumentChunk chunk = chunks.get(i);
            if (cancelled.getAsBoolean()) {
                this.abort(documentId, i);
            }
            try {
                this.vectorIndex.upsert(chunk.getId(), documentId, vectors.get(i));
                this.lexicalIndex.upsert(chunk.getId(), documentId, chunk.getText());
            } catch (RuntimeException e) {
                IndexWriteException failure = new IndexWriteException(
                        "Index write failed at chunk " + chunk.getChunkIndex() + ": " + e.getMessage(), chunk.getChunkIndex(), e);
                this.rollback(documentId, failure);
                throw failure;
            }
        }
        if (cancelled.getAsBoolean()) {
            this.abort(documentId, chunks.size());
        }
        log.info(">> Indexed {} chunks in vector and lexical indexes", chunks.size());
        return chunks.size();
    }

    /**
     * Removes every entry of the document from both indexes.
     */
    public void purge(String documentId) {
        long vectors = this.vectorIndex.deleteByDocument(documentId);
        long terms = this.lexicalIndex.deleteByDocument(documentId);
        if (vectors > 0 || terms > 0) {
            log.info("Purged {} vector and {} lexical entries", vectors, terms);
        }
    }

    private void abort(String documentId, int written) {
        log.info("Document deleted during indexing after {} chunk(s); removing partial entries", written);
        IngestionCancelledException cancelled = new IngestionCancelledException(documentId);
        this.rollback(documentId, cancelled);
        throw cancelled;
    }

    private void rollback(String documentId, RuntimeException cause) {
        try {
            this.purge(documentId);
        } catch (RuntimeException purgeFailure) {
            log.error("Rollback of partial index entries failed", purgeFailure);
            cause.addSuppressed(purgeFailure);
        }
    }
}
