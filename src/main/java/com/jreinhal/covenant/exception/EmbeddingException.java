package com.jreinhal.covenant.exception;

/**
 * Embedding call failure. {@code chunkIndex} identifies the first chunk of the batch that
 * could not be embedded, or is {@code -1} for query embeddings.
 */
public class EmbeddingException extends RuntimeException {
    private final int chunkIndex;
    private final boolean transientFailure;
    private final int attempts;

    public EmbeddingException(String message, int chunkIndex, boolean transientFailure, int attempts, Throwable cause) {
        super(message, cause);
        this.chunkIndex = chunkIndex;
        this.transientFailure = transientFailure;
        this.attempts = attempts;
    }

    public int getChunkIndex() {
        return this.chunkIndex;
    }

    public boolean isTransientFailure() {
        return this.transientFailure;
    }

    public int getAttempts() {
        return this.attempts;
    }
}
