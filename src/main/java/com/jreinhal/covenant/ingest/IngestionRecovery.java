package com.jreinhal.covenant.ingest;

import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.repository.DocumentStore;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Reconciles stored statuses with the empty in-memory state of a fresh process.
 *
 * <p>Documents left mid-stage by a previous process are marked FAILED so they show a retry
 * action, PENDING documents are queued again, and unfinished deletions are completed.</p>
 */
@Component
@ConditionalOnProperty(name = "covenant.ingestion.recover-on-startup", havingValue = "true", matchIfMissing = true)
public class IngestionRecovery {
    private static final Logger log = LoggerFactory.getLogger(IngestionRecovery.class);
    static final String INTERRUPTED_REASON = "Processing was interrupted by a restart; reprocess to retry";

    private final DocumentStore documentStore;
    private final IngestionOrchestrator orchestrator;

    public IngestionRecovery(DocumentStore documentStore, IngestionOrchestrator orchestrator) {
        this.documentStore = documentStore;
        this.orchestrator = orchestrator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recover() {
        List<ContractDocument> stranded = this.documentStore.findByStatusIn(
                EnumSet.of(DocumentStatus.PENDING, DocumentStatus.EXTRACTING, DocumentStatus.CHUNKING,
                        DocumentStatus.EMBEDDING, DocumentStatus.DELETED));
        int failed = 0;
        int resumed = 0;
        int deleted = 0;
        for (ContractDocument document : stranded) {
            String id = document.getId();
            if (document.getStatus() == DocumentStatus.DELETED) {
                this.orchestrator.completeDeletion(id);
                deleted++;
            } else if (document.getStatus() == DocumentStatus.PENDING) {
                try {
                    if (this.orchestrator.resume(id)) {
                        resumed++;
                    }
                } catch (RejectedExecutionException e) {
                    log.warn("Ingestion queue full during recovery; document marked failed: {}", e.getMessage());
                    failed++;
                }
            } else if (this.documentStore.markFailed(id, INTERRUPTED_REASON, null)) {
                failed++;
            }
        }
        if (!stranded.isEmpty()) {
            log.info("Ingestion recovery: {} marked failed, {} re-queued, {} deletions completed", failed, resumed, deleted);
        }
    }
}
