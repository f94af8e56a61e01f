package com.jreinhal.covenant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "covenant.chunking")
public class ChunkingProperties {
    /**
     * Window size in characters.
     */
    private int chunkSize = 1000;

    /**
     * Characters shared by consecutive windows so a clause cut at a window edge
     * appears whole in at least one chunk. Must be smaller than {@link #chunkSize}.
     */
    private int chunkOverlap = 200;

    public void validate() {
        if (chunkSize <= 0) {
            throw new IllegalStateException("covenant.chunking.chunk-size must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalStateException("covenant.chunking.chunk-overlap must be in [0, chunk-size)");
        }
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }
}
