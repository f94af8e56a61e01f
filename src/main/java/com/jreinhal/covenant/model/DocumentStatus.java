package com.jreinhal.covenant.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Extraction lifecycle of a {@link ContractDocument}.
 *
 * <pre>
 * PENDING -> EXTRACTING -> CHUNKING -> EMBEDDING -> INDEXED
 *     any stage -> FAILED
 *     INDEXED / FAILED -> PENDING (reprocess)
 * </pre>
 *
 * DELETED is a tombstone written the moment deletion is requested so that a worker
 * still processing the document observes it before its next index write.
 */
public enum DocumentStatus {
    PENDING,
    EXTRACTING,
    CHUNKING,
    EMBEDDING,
    INDEXED,
    FAILED,
    DELETED;

    public static final Set<DocumentStatus> IN_PROGRESS = EnumSet.of(EXTRACTING, CHUNKING, EMBEDDING);
    public static final Set<DocumentStatus> REPROCESSABLE = EnumSet.of(PENDING, INDEXED, FAILED);

    public boolean isTerminal() {
        return this == INDEXED || this == FAILED;
    }

    public boolean isInProgress() {
        return IN_PROGRESS.contains(this);
    }
}
