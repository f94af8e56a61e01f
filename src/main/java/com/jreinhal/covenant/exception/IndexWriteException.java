package com.jreinhal.covenant.exception;

public class IndexWriteException extends RuntimeException {
    private final int chunkIndex;

    public IndexWriteException(String message, int chunkIndex, Throwable cause) {
        super(message, cause);
        this.chunkIndex = chunkIndex;
    }

    public int getChunkIndex() {
        return this.chunkIndex;
    }
}
