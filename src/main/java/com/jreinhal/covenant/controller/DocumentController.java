package com.jreinhal.covenant.controller;

import com.jreinhal.covenant.ingest.IngestionOrchestrator;
import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.util.LogSanitizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Upload, inspection, reprocessing and deletion of contracts. Uploads return as soon as the
 * document is queued; extraction runs on the ingestion pool.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final IngestionOrchestrator orchestrator;

    public DocumentController(IngestionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> upload(@RequestParam("file") MultipartFile file,
                                                      @RequestParam(value = "documentId", required = false) String documentId,
                                                      @RequestParam(value = "type", required = false) String type) {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file", e);
        }
        ContractDocument document = this.orchestrator.ingest(documentId, file.getOriginalFilename(), content, type);
        log.info("Accepted upload {} ({} bytes) as {}", LogSanitizer.sanitize(file.getOriginalFilename()),
                content.length, document.getId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("documentId", document.getId());
        body.put("status", document.getStatus());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContractDocument> getDocument(@PathVariable("id") String id) {
        return ResponseEntity.ok(this.orchestrator.getDocument(id));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<Map<String, Object>> getStatus(@PathVariable("id") String id) {
        ContractDocument document = this.orchestrator.getDocument(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("documentId", document.getId());
        body.put("status", document.getStatus());
        body.put("failureReason", document.getStatus() == DocumentStatus.FAILED ? document.getFailureReason() : null);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}/chunks")
    public ResponseEntity<List<DocumentChunk>> getChunks(@PathVariable("id") String id) {
        return ResponseEntity.ok(this.orchestrator.getChunks(id));
    }

    @PostMapping("/{id}/reprocess")
    public ResponseEntity<Map<String, Object>> reprocess(@PathVariable("id") String id) {
        boolean queued = this.orchestrator.reprocess(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("documentId", id);
        body.put("queued", queued);
        if (!queued) {
            body.put("message", "Document is already being processed");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String id) {
        this.orchestrator.delete(id);
        return ResponseEntity.noContent().build();
    }
}
