package com.jreinhal.covenant.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.jreinhal.covenant.config.EmbeddingProperties;
import com.jreinhal.covenant.exception.EmbeddingException;
import com.jreinhal.covenant.model.DocumentChunk;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Produces chunk and query vectors through the configured {@link EmbeddingModel}.
 *
 * <p>Chunks are sent in batches of {@code covenant.embedding.batch-size}. Each call runs under
 * {@code covenant.embedding.timeout}; timeouts, 5xx, 429 and connection failures are retried with
 * exponential backoff capped at {@code max-backoff}, up to {@code max-attempts} attempts. Any other
 * failure, or exhausting the attempts, raises {@link EmbeddingException} naming the first chunk of
 * the failed batch. A document is therefore either fully embedded or not at all.</p>
 */
@Service
public class EmbeddingGenerator {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingGenerator.class);

    private final EmbeddingModel embeddingModel;
    private final EmbeddingProperties properties;
    private final ExecutorService modelCallExecutor;
    private final Cache<String, float[]> queryEmbeddingCache;
    private final Sleeper sleeper;

    @Autowired
    public EmbeddingGenerator(EmbeddingModel embeddingModel, EmbeddingProperties properties,
                              @Qualifier("modelCallExecutor") ExecutorService modelCallExecutor,
                              Cache<String, float[]> queryEmbeddingCache) {
        this(embeddingModel, properties, modelCallExecutor, queryEmbeddingCache, Thread::sleep);
    }

    EmbeddingGenerator(EmbeddingModel embeddingModel, EmbeddingProperties properties, ExecutorService modelCallExecutor,
                       Cache<String, float[]> queryEmbeddingCache, Sleeper sleeper) {
        this.embeddingModel = embeddingModel;
        this.properties = properties;
        this.modelCallExecutor = modelCallExecutor;
        this.queryEmbeddingCache = queryEmbeddingCache;
        this.sleeper = sleeper;
    }

    public String getModelId() {
        return this.properties.getModelId();
    }

    /**
     * @return one vector per chunk, in chunk order
     */
    public List<float[]> embedChunks(List<DocumentChunk> chunks) {
        List<float[]> vectors = new ArrayList<>(chunks.size());
        int batchSize = Math.max(1, this.properties.getBatchSize());
        int calls = 0;
        int dimensions = -1;
        for (int from = 0; from < chunks.size(); from += batchSize) {
            List<DocumentChunk> batch = chunks.subList(from, Math.min(from + batchSize, chunks.size()));
            List<String> texts = batch.stream().map(this::embeddingText).toList();
            int firstIndex = batch.get(0).getChunkIndex();
            List<float[]> batchVectors = this.callWithRetry(texts, firstIndex, this.properties.getMaxAttempts());
            calls++;
            if (batchVectors == null || batchVectors.size() != texts.size()) {
                throw new EmbeddingException("Embedding provider returned " + (batchVectors == null ? 0 : batchVectors.size())
                        + " vectors for " + texts.size() + " chunks", firstIndex, false, 1, null);
            }
            for (int i = 0; i < batchVectors.size(); i++) {
                float[] vector = batchVectors.get(i);
                int chunkIndex = batch.get(i).getChunkIndex();
                if (vector == null || vector.length == 0) {
                    throw new EmbeddingException("Empty embedding for chunk " + chunkIndex, chunkIndex, false, 1, null);
                }
                if (dimensions < 0) {
                    dimensions = vector.length;
                } else if (vector.length != dimensions) {
                    throw new EmbeddingException("Embedding dimension changed from " + dimensions + " to " + vector.length
                            + " at chunk " + chunkIndex, chunkIndex, false, 1, null);
                }
                vectors.add(vector);
            }
        }
        log.info(">> Embedded {} chunks in {} call(s), dimensions={}", chunks.size(), calls, dimensions);
        return vectors;
    }

    /**
     * Embeds a search query. Results are cached by query text.
     */
    public float[] embedQuery(String query) {
        String key = query.strip();
        float[] cached = this.queryEmbeddingCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        List<float[]> result = this.callWithRetry(List.of(key), -1, this.properties.getQueryMaxAttempts());
        if (result == null || result.isEmpty() || result.get(0) == null || result.get(0).length == 0) {
            throw new EmbeddingException("Embedding provider returned no vector for the query", -1, false, 1, null);
        }
        float[] vector = result.get(0);
        this.queryEmbeddingCache.put(key, vector);
        return vector;
    }

    /**
     * Text sent to the provider for a chunk. A known clause title is prefixed so the vector
     * carries the clause context even when the window holds only its tail.
     */
    public String embeddingText(DocumentChunk chunk) {
        if (this.properties.isContextualPrefix() && chunk.getClauseTitle() != null && !chunk.getClauseTitle().isBlank()) {
            return "[Clause: " + chunk.getClauseTitle() + "] " + chunk.getText();
        }
        return chunk.getText();
    }

    private List<float[]> callWithRetry(List<String> texts, int chunkIndex, int maxAttempts) {
        int attempts = Math.max(1, maxAttempts);
        long backoffMs = Math.max(0L, this.properties.getInitialBackoff().toMillis());
        long maxBackoffMs = Math.max(backoffMs, this.properties.getMaxBackoff().toMillis());
        for (int attempt = 1; ; attempt++) {
            Throwable failure;
            try {
                return this.callOnce(texts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmbeddingException("Interrupted while embedding", chunkIndex, false, attempt, e);
            } catch (ExecutionException e) {
                failure = e.getCause() != null ? e.getCause() : e;
            } catch (TimeoutException | RuntimeException e) {
                failure = e;
            }
            boolean transientFailure = isTransient(failure);
            if (!transientFailure || attempt >= attempts) {
                String target = chunkIndex >= 0 ? "chunk " + chunkIndex : "query";
                String reason = transientFailure
                        ? "Embedding failed for " + target + " after " + attempt + " attempts: " + describe(failure)
                        : "Embedding failed for " + target + ": " + describe(failure);
                throw new EmbeddingException(reason, chunkIndex, transientFailure, attempt, failure);
            }
            log.warn("Embedding call failed (attempt {}/{}), retrying in {}ms: {}", attempt, attempts, backoffMs, describe(failure));
            try {
                this.sleeper.sleep(backoffMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmbeddingException("Interrupted during embedding backoff", chunkIndex, true, attempt, e);
            }
            backoffMs = Math.min(maxBackoffMs, (long) (backoffMs * this.properties.getBackoffMultiplier()));
        }
    }

    private List<float[]> callOnce(List<String> texts) throws InterruptedException, ExecutionException, TimeoutException {
        Future<List<float[]>> future = this.modelCallExecutor.submit(() -> this.embeddingModel.embed(texts));
        try {
            return future.get(this.properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            // frees the pool thread held by a hung provider call
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Timeouts, rate limiting, server errors and connection failures are worth retrying;
     * anything else (bad request, auth, malformed response) will fail the same way again.
     */
    static boolean isTransient(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < 8; depth++) {
            if (current instanceof NonTransientAiException) {
                return false;
            }
            if (current instanceof TransientAiException
                    || current instanceof TimeoutException
                    || current instanceof ResourceAccessException
                    || current instanceof RejectedExecutionException
                    || current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof InterruptedIOException) {
                return true;
            }
            if (current instanceof RestClientResponseException response) {
                int status = response.getStatusCode().value();
                return status == 429 || status >= 500;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
