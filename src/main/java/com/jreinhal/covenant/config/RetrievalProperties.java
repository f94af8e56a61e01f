package com.jreinhal.covenant.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "covenant.retrieval")
public class RetrievalProperties {
    /**
     * Reciprocal rank fusion constant.
     */
    private int rrfK = 60;

    /**
     * Cosine distance at or beyond which a candidate with no lexical match is dropped.
     */
    private double maxVectorDistance = 0.55;

    /**
     * Per-embedding-model overrides of {@link #maxVectorDistance}. Distance scales differ
     * between models, so each provider should be tuned separately.
     *
     * Example:
     * covenant.retrieval.max-vector-distance-by-model.text-embedding-3-small=0.62
     */
    private Map<String, Double> maxVectorDistanceByModel = new HashMap<>();

    private int defaultResultCount = 10;
    private int maxResultCount = 50;

    /**
     * Upper bound for each index query leg.
     */
    private Duration legTimeout = Duration.ofSeconds(20);

    public double resolveMaxVectorDistance(String modelId) {
        if (modelId != null) {
            Double override = maxVectorDistanceByModel.get(modelId);
            if (override != null) {
                return override;
            }
        }
        return maxVectorDistance;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public double getMaxVectorDistance() {
        return maxVectorDistance;
    }

    public void setMaxVectorDistance(double maxVectorDistance) {
        this.maxVectorDistance = maxVectorDistance;
    }

    public Map<String, Double> getMaxVectorDistanceByModel() {
        return maxVectorDistanceByModel;
    }

    public void setMaxVectorDistanceByModel(Map<String, Double> maxVectorDistanceByModel) {
        this.maxVectorDistanceByModel = maxVectorDistanceByModel;
    }

    public int getDefaultResultCount() {
        return defaultResultCount;
    }

    public void setDefaultResultCount(int defaultResultCount) {
        this.defaultResultCount = defaultResultCount;
    }

    public int getMaxResultCount() {
        return maxResultCount;
    }

    public void setMaxResultCount(int maxResultCount) {
        this.maxResultCount = maxResultCount;
    }

    public Duration getLegTimeout() {
        return legTimeout;
    }

    public void setLegTimeout(Duration legTimeout) {
        this.legTimeout = legTimeout;
    }
}
