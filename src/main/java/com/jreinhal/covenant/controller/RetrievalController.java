package com.jreinhal.covenant.controller;

import com.jreinhal.covenant.model.AnswerResult;
import com.jreinhal.covenant.model.RetrievalCandidate;
import com.jreinhal.covenant.rag.answer.AnswerSynthesisService;
import com.jreinhal.covenant.rag.retrieval.HybridRetrievalService;
import com.jreinhal.covenant.rag.retrieval.RetrievalMode;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class RetrievalController {

    private final HybridRetrievalService retrievalService;
    private final AnswerSynthesisService answerService;

    public RetrievalController(HybridRetrievalService retrievalService, AnswerSynthesisService answerService) {
        this.retrievalService = retrievalService;
        this.answerService = answerService;
    }

    /**
     * Ranked excerpts for a query, without an answer. {@code n <= 0} selects the configured default.
     */
    @GetMapping("/search")
    public ResponseEntity<List<RetrievalCandidate>> search(@RequestParam("q") String query,
                                                           @RequestParam(value = "n", defaultValue = "0") int n,
                                                           @RequestParam(value = "documentId", required = false) String documentId,
                                                           @RequestParam(value = "mode", required = false) String mode) {
        RetrievalMode retrievalMode = RetrievalMode.fromParam(mode);
        return ResponseEntity.ok(this.retrievalService.search(query, n, blankToNull(documentId), retrievalMode));
    }

    @PostMapping("/answer")
    public ResponseEntity<AnswerResult> answer(@RequestBody AnswerRequest request) {
        return ResponseEntity.ok(this.answerService.answer(request.question(), blankToNull(request.documentId())));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    public record AnswerRequest(String question, String documentId) {
    }
}
