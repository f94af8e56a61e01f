package com.jreinhal.covenant.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "covenant.embedding")
public class EmbeddingProperties implements EnvironmentAware {
    public static final String DEFAULT_MODEL_ID = "nomic-embed-text";
    static final String PROVIDER_PROPERTY = "spring.ai.model.embedding";

    /**
     * Identifier of the active embedding model. Selects the per-model distance floor and is
     * stored with every vector. When blank it is read from the active provider's
     * {@code spring.ai.<provider>.embedding.options.model}.
     */
    private String modelId;

    private Environment environment;

    /**
     * Chunks sent per provider call.
     */
    private int batchSize = 32;

    /**
     * Total attempts per batch, including the first.
     */
    private int maxAttempts = 4;

    /**
     * Attempts per query embedding. Kept low because a user is waiting.
     */
    private int queryMaxAttempts = 2;

    private Duration initialBackoff = Duration.ofMillis(500);
    private Duration maxBackoff = Duration.ofSeconds(8);
    private double backoffMultiplier = 2.0;

    /**
     * Per-call timeout. Exceeding it counts as a transient failure.
     */
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Prefix the clause title to the embedded text, e.g. {@code [Clause: Fees] ...}.
     * Lexical indexing and citations always use the raw chunk text.
     */
    private boolean contextualPrefix = true;

    private int queryCacheSize = 1000;
    private Duration queryCacheTtl = Duration.ofMinutes(30);

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    public String getModelId() {
        if (modelId != null && !modelId.isBlank()) {
            return modelId;
        }
        if (environment == null) {
            return DEFAULT_MODEL_ID;
        }
        String provider = environment.getProperty(PROVIDER_PROPERTY, "ollama");
        return environment.getProperty("spring.ai." + provider + ".embedding.options.model", DEFAULT_MODEL_ID);
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getQueryMaxAttempts() {
        return queryMaxAttempts;
    }

    public void setQueryMaxAttempts(int queryMaxAttempts) {
        this.queryMaxAttempts = queryMaxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public boolean isContextualPrefix() {
        return contextualPrefix;
    }

    public void setContextualPrefix(boolean contextualPrefix) {
        this.contextualPrefix = contextualPrefix;
    }

    public int getQueryCacheSize() {
        return queryCacheSize;
    }

    public void setQueryCacheSize(int queryCacheSize) {
        this.queryCacheSize = queryCacheSize;
    }

    public Duration getQueryCacheTtl() {
        return queryCacheTtl;
    }

    public void setQueryCacheTtl(Duration queryCacheTtl) {
        this.queryCacheTtl = queryCacheTtl;
    }
}
