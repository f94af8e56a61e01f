package com.jreinhal.covenant.rag.answer;

import com.jreinhal.covenant.config.AnswerProperties;
import com.jreinhal.covenant.exception.AnswerUnavailableException;
import com.jreinhal.covenant.model.AnswerResult;
import com.jreinhal.covenant.model.RetrievalCandidate;
import com.jreinhal.covenant.rag.answer.ContextWindowBuilder.ContextWindow;
import com.jreinhal.covenant.rag.retrieval.HybridRetrievalService;
import com.jreinhal.covenant.util.LogSanitizer;
import com.jreinhal.covenant.util.ModelCircuitBreaker;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Answers a question from retrieved contract excerpts.
 *
 * <p>Zero candidates produce the explicit no-evidence answer without a model call. Candidates
 * that leave the context window empty raise {@link AnswerUnavailableException}, also without
 * a model call. Otherwise the model is called once under {@code covenant.answer.timeout}; any
 * call failure, timeouts and empty replies included, raises {@link AnswerUnavailableException}
 * and is never retried here.</p>
 */
@Service
public class AnswerSynthesisService {
    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesisService.class);

    private final HybridRetrievalService retrievalService;
    private final ContextWindowBuilder contextWindowBuilder;
    private final CitationResolver citationResolver;
    private final ChatClient chatClient;
    private final AnswerProperties properties;
    private final ExecutorService modelCallExecutor;
    private final ModelCircuitBreaker circuitBreaker;
    private final MetadataAnswerer metadataAnswerer;

    public AnswerSynthesisService(HybridRetrievalService retrievalService, ContextWindowBuilder contextWindowBuilder,
                                  CitationResolver citationResolver, ChatClient.Builder chatClientBuilder,
                                  AnswerProperties properties,
                                  @Qualifier("modelCallExecutor") ExecutorService modelCallExecutor,
                                  MetadataAnswerer metadataAnswerer) {
        properties.validate();
        this.retrievalService = retrievalService;
        this.contextWindowBuilder = contextWindowBuilder;
        this.citationResolver = citationResolver;
        this.chatClient = chatClientBuilder.build();
        this.properties = properties;
        this.modelCallExecutor = modelCallExecutor;
        this.circuitBreaker = new ModelCircuitBreaker(properties.getCircuitFailureThreshold(), properties.getCircuitOpenDuration());
        this.metadataAnswerer = metadataAnswerer;
    }

    /**
     * Questions about one document's parties, dates, governing law, mutuality, term or survival
     * are answered from its stored metadata when it has the fact; everything else goes through
     * retrieval and the model.
     *
     * @param documentId restricts the evidence to one document, or {@code null} for the corpus
     */
    public AnswerResult answer(String question, String documentId) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
        Optional<AnswerResult> fromMetadata = this.metadataAnswerer.answer(question, documentId);
        if (fromMetadata.isPresent()) {
            return fromMetadata.get();
        }
        List<RetrievalCandidate> candidates = this.retrievalService.search(question, this.properties.getCandidateCount(), documentId);
        return this.synthesize(question, candidates);
    }

    public AnswerResult synthesize(String question, List<RetrievalCandidate> candidates) {
        if (candidates.isEmpty()) {
            log.info("No evidence for query {}; answering without the model", LogSanitizer.querySummary(question));
            return AnswerResult.noEvidence();
        }
        ContextWindow window = this.contextWindowBuilder.build(candidates, this.properties.getMaxContextChars());
        if (window.excerpts().isEmpty()) {
            log.warn("No excerpt fits covenant.answer.max-context-chars={} for query {}; not calling the model",
                    this.properties.getMaxContextChars(), LogSanitizer.querySummary(question));
            throw new AnswerUnavailableException("No retrieved excerpt fits the configured context budget");
        }
        long startTime = System.currentTimeMillis();
        String raw = this.callModel(question, window);
        if (AnswerPrompts.isRefusal(raw)) {
            log.info("Model found no answer in {} excerpt(s) for query {}", window.excerpts().size(),
                    LogSanitizer.querySummary(question));
            return new AnswerResult(AnswerPrompts.REFUSAL, List.of(), false, candidates.size());
        }
        CitationResolver.Resolution resolution = this.citationResolver.resolve(raw, window);
        log.info(">> Answer generated in {}ms: {} excerpt(s) in context, {} citation(s)",
                System.currentTimeMillis() - startTime, window.excerpts().size(), resolution.citations().size());
        return new AnswerResult(resolution.text(), resolution.citations(), true, candidates.size());
    }

    private String callModel(String question, ContextWindow window) {
        if (!this.circuitBreaker.allowRequest()) {
            throw new AnswerUnavailableException("Language model is temporarily unavailable; retry in "
                    + Math.max(1L, this.circuitBreaker.remainingOpenMillis() / 1000L) + "s");
        }
        String userMessage = AnswerPrompts.user(question, window.text());
        long timeoutMs = this.properties.getTimeout().toMillis();
        Future<String> future;
        try {
            future = this.modelCallExecutor.submit(
                    () -> this.chatClient.prompt().system(AnswerPrompts.SYSTEM).user(userMessage).call().content());
        } catch (RejectedExecutionException e) {
            throw new AnswerUnavailableException("Too many answers in progress; retry shortly", e);
        }
        String content;
        try {
            content = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            this.circuitBreaker.recordFailure();
            log.warn("LLM response timed out after {}ms for query {}", timeoutMs, LogSanitizer.querySummary(question));
            throw new AnswerUnavailableException("Language model timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            this.circuitBreaker.recordFailure();
            log.warn("LLM call failed for query {}: {}", LogSanitizer.querySummary(question), cause.getMessage());
            throw new AnswerUnavailableException("Language model call failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AnswerUnavailableException("Interrupted while waiting for the language model", e);
        }
        if (content == null || content.isBlank()) {
            this.circuitBreaker.recordFailure();
            throw new AnswerUnavailableException("Language model returned an empty answer");
        }
        this.circuitBreaker.recordSuccess();
        return content.strip();
    }

    ModelCircuitBreaker.State getCircuitState() {
        return this.circuitBreaker.getState();
    }
}
