package com.jreinhal.covenant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "covenant.ingestion")
public class IngestionProperties {
    /**
     * Documents processed concurrently. Bounds embedding-API and OCR load.
     */
    private int workerPoolSize = 3;

    /**
     * Documents allowed to wait for a worker before uploads are rejected.
     */
    private int queueCapacity = 500;

    /**
     * A PDF page with fewer extractable characters than this is sent to OCR.
     */
    private int minCharsPerPage = 100;

    /**
     * Largest file accepted, in bytes. Stored content lives in a single Mongo document.
     */
    private int maxContentBytes = 15 * 1024 * 1024;

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getMinCharsPerPage() {
        return minCharsPerPage;
    }

    public void setMinCharsPerPage(int minCharsPerPage) {
        this.minCharsPerPage = minCharsPerPage;
    }

    public int getMaxContentBytes() {
        return maxContentBytes;
    }

    public void setMaxContentBytes(int maxContentBytes) {
        this.maxContentBytes = maxContentBytes;
    }
}
