package com.jreinhal.covenant.controller;

import com.jreinhal.covenant.ingest.IngestionOrchestrator;
import com.jreinhal.covenant.model.IngestionProgress;
import com.jreinhal.covenant.model.ProcessingJob;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bulk reindexing and a view of the ingestion workers.
 */
@RestController
@RequestMapping("/api/admin")
public class IngestionAdminController {

    private static final Logger log = LoggerFactory.getLogger(IngestionAdminController.class);

    private final IngestionOrchestrator orchestrator;

    public IngestionAdminController(IngestionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/ingestion/progress")
    public ResponseEntity<IngestionProgress> getProgress() {
        return ResponseEntity.ok(this.orchestrator.getProgress());
    }

    @GetMapping("/ingestion/jobs")
    public ResponseEntity<List<ProcessingJob>> getActiveJobs() {
        return ResponseEntity.ok(this.orchestrator.getActiveJobs());
    }

    /**
     * Requeues every indexed or failed document. A second request while a reindex is running
     * queues nothing and reports {@code queued: 0}.
     */
    @PostMapping("/reindex")
    public ResponseEntity<Map<String, Object>> reindex() {
        boolean alreadyRunning = this.orchestrator.isReindexRunning();
        int queued = this.orchestrator.reprocessAll();
        log.info("Reindex requested: {} document(s) queued", queued);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("queued", queued);
        body.put("alreadyRunning", alreadyRunning && queued == 0);
        body.put("progress", this.orchestrator.getProgress());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }
}
