package com.jreinhal.covenant.rag.retrieval;

import com.jreinhal.covenant.config.RetrievalProperties;
import com.jreinhal.covenant.exception.RetrievalUnavailableException;
import com.jreinhal.covenant.index.LexicalIndex;
import com.jreinhal.covenant.index.LexicalIndex.LexicalHit;
import com.jreinhal.covenant.index.VectorIndex;
import com.jreinhal.covenant.index.VectorIndex.VectorHit;
import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.model.RetrievalCandidate;
import com.jreinhal.covenant.rag.retrieval.ReciprocalRankFusion.Fused;
import com.jreinhal.covenant.repository.ChunkStore;
import com.jreinhal.covenant.repository.DocumentStore;
import com.jreinhal.covenant.service.EmbeddingGenerator;
import com.jreinhal.covenant.util.LogSanitizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid search over the vector and lexical indexes.
 *
 * <ol>
 *   <li>The keyword leg searches the query after {@link QueryNormalizer} has fixed spelling and
 *       added contract synonyms; the vector leg embeds the query as asked.</li>
 *   <li>Both legs run in parallel, each asking its index for {@code 2n} hits, scoped to one
 *       document when a filter is given.</li>
 *   <li>The rankings are merged with {@link ReciprocalRankFusion}.</li>
 *   <li>A candidate with no lexical match is dropped when its cosine distance is at or beyond
 *       the relevance floor of the active embedding model. A lexical match is never dropped
 *       for distance alone.</li>
 *   <li>Chunks are loaded and anything whose document is not INDEXED at that moment is
 *       removed, which hides documents deleted or reprocessed while the query ran.</li>
 *   <li>The list is truncated to {@code n}.</li>
 * </ol>
 *
 * If one leg fails or times out the other leg's ranking is used alone; if every leg the mode
 * needs fails, {@link RetrievalUnavailableException} is thrown.
 */
@Service
public class HybridRetrievalService {
    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalService.class);

    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;
    private final EmbeddingGenerator embeddingGenerator;
    private final ChunkStore chunkStore;
    private final DocumentStore documentStore;
    private final RetrievalProperties properties;
    private final Executor retrievalExecutor;
    private final QueryNormalizer queryNormalizer;

    public HybridRetrievalService(VectorIndex vectorIndex, LexicalIndex lexicalIndex, EmbeddingGenerator embeddingGenerator,
                                  ChunkStore chunkStore, DocumentStore documentStore, RetrievalProperties properties,
                                  @Qualifier("retrievalExecutor") Executor retrievalExecutor, QueryNormalizer queryNormalizer) {
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
        this.embeddingGenerator = embeddingGenerator;
        this.chunkStore = chunkStore;
        this.documentStore = documentStore;
        this.properties = properties;
        this.retrievalExecutor = retrievalExecutor;
        this.queryNormalizer = queryNormalizer;
    }

    public List<RetrievalCandidate> search(String query, int n, String documentId) {
        return this.search(query, n, documentId, RetrievalMode.HYBRID);
    }

    /**
     * @param n result count; non-positive means the configured default, larger than the
     *          configured maximum is capped
     * @param documentId restricts both legs to one document, or {@code null} for the corpus
     */
    public List<RetrievalCandidate> search(String query, int n, String documentId, RetrievalMode mode) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be empty");
        }
        int limit = this.resolveLimit(n);
        int perLeg = limit * 2;
        String scope = documentId == null || documentId.isBlank() ? null : documentId;
        long startTime = System.currentTimeMillis();

        CompletableFuture<List<VectorHit>> vectorFuture = mode.usesVector()
                ? this.startLeg(() -> this.vectorIndex.query(this.embeddingGenerator.embedQuery(query), perLeg, scope))
                : CompletableFuture.completedFuture(List.of());
        String keywordQuery = this.queryNormalizer.expandForKeywordSearch(query);
        CompletableFuture<List<LexicalHit>> lexicalFuture = mode.usesLexical()
                ? this.startLeg(() -> this.lexicalIndex.query(keywordQuery, perLeg, scope))
                : CompletableFuture.completedFuture(List.of());
        long deadline = startTime + this.properties.getLegTimeout().toMillis();
        LegOutcome<VectorHit> vector = this.await("vector", vectorFuture, deadline);
        LegOutcome<LexicalHit> lexical = this.await("lexical", lexicalFuture, deadline);

        boolean vectorDown = mode.usesVector() && vector.failure() != null;
        boolean lexicalDown = mode.usesLexical() && lexical.failure() != null;
        if ((vectorDown || !mode.usesVector()) && (lexicalDown || !mode.usesLexical())) {
            Throwable cause = vectorDown ? vector.failure() : lexical.failure();
            throw new RetrievalUnavailableException("Search is unavailable: no index could be queried", cause);
        }

        List<Fused> fused = ReciprocalRankFusion.fuse(vector.hits(), lexical.hits(), this.properties.getRrfK());
        double floor = this.properties.resolveMaxVectorDistance(this.embeddingGenerator.getModelId());
        List<Fused> relevant = fused.stream().filter(f -> passesRelevanceFloor(f, floor)).toList();
        List<RetrievalCandidate> candidates = this.hydrate(relevant, limit);

        if (log.isInfoEnabled()) {
            log.info("Retrieval {} for query {}: vector={}{}, lexical={}{}, fused={}, afterFloor={}, returned={} in {}ms",
                    mode, LogSanitizer.querySummary(query), vector.hits().size(), vectorDown ? " (failed)" : "",
                    lexical.hits().size(), lexicalDown ? " (failed)" : "", fused.size(), relevant.size(),
                    candidates.size(), System.currentTimeMillis() - startTime);
        }
        return candidates;
    }

    /**
     * Keeps a candidate with a lexical match unconditionally; otherwise keeps it only when its
     * distance is strictly below {@code maxDistance}.
     */
    static boolean passesRelevanceFloor(Fused candidate, double maxDistance) {
        if (candidate.lexicalScore() > 0.0) {
            return true;
        }
        return candidate.vectorDistance() != null && candidate.vectorDistance() < maxDistance;
    }

    private List<RetrievalCandidate> hydrate(List<Fused> relevant, int limit) {
        if (relevant.isEmpty()) {
            return List.of();
        }
        Set<String> chunkIds = relevant.stream().map(Fused::chunkId).collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, DocumentChunk> chunks = this.chunkStore.findByIds(chunkIds).stream()
                .collect(Collectors.toMap(DocumentChunk::getId, Function.identity(), (a, b) -> a));
        Set<String> documentIds = relevant.stream().map(Fused::documentId).collect(Collectors.toSet());
        Map<String, DocumentStatus> statuses = this.documentStore.findStatuses(documentIds);

        List<RetrievalCandidate> candidates = new ArrayList<>(Math.min(limit, relevant.size()));
        Set<String> seen = new LinkedHashSet<>();
        for (Fused f : relevant) {
            if (candidates.size() >= limit) {
                break;
            }
            DocumentChunk chunk = chunks.get(f.chunkId());
            if (chunk == null || statuses.get(chunk.getDocumentId()) != DocumentStatus.INDEXED || !seen.add(chunk.getId())) {
                continue;
            }
            candidates.add(new RetrievalCandidate(chunk, f.vectorDistance(), f.lexicalScore(), f.vectorRank(),
                    f.lexicalRank(), f.fusedScore(), candidates.size() + 1));
        }
        return candidates;
    }

    private int resolveLimit(int n) {
        if (n <= 0) {
            return Math.max(1, this.properties.getDefaultResultCount());
        }
        return Math.min(n, Math.max(1, this.properties.getMaxResultCount()));
    }

    private <T> CompletableFuture<List<T>> startLeg(Supplier<List<T>> leg) {
        try {
            return CompletableFuture.supplyAsync(leg, this.retrievalExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> LegOutcome<T> await(String leg, CompletableFuture<List<T>> future, long deadline) {
        long remainingMs = Math.max(1L, deadline - System.currentTimeMillis());
        try {
            return new LegOutcome<>(future.get(remainingMs, TimeUnit.MILLISECONDS), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Retrieval {} leg interrupted", leg);
            return new LegOutcome<>(List.of(), e);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Retrieval {} leg timed out after {}ms", leg, this.properties.getLegTimeout().toMillis());
            return new LegOutcome<>(List.of(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Retrieval {} leg failed: {}", leg, cause.getMessage());
            return new LegOutcome<>(List.of(), cause);
        }
    }

    private record LegOutcome<T>(List<T> hits, Throwable failure) {
    }
}
