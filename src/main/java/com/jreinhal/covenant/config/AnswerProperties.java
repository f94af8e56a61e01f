package com.jreinhal.covenant.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "covenant.answer")
public class AnswerProperties {
    /**
     * Smallest context budget that still fits one excerpt header and a useful slice of text.
     */
    public static final int MIN_CONTEXT_CHARS = 500;

    /**
     * Character budget for the evidence block sent to the language model.
     */
    private int maxContextChars = 12000;

    /**
     * Candidates retrieved for each question.
     */
    private int candidateCount = 8;

    /**
     * Language model timeout. Exceeding it fails the answer; there is no retry.
     */
    private Duration timeout = Duration.ofSeconds(60);

    /**
     * Ask the model to locate a quote when exact and fuzzy matching both fail.
     */
    private boolean llmSpanMatchEnabled = true;

    /**
     * Share of quote tokens a text window must contain to count as a fuzzy match.
     */
    private double fuzzyMatchThreshold = 0.8;

    private int circuitFailureThreshold = 3;
    private Duration circuitOpenDuration = Duration.ofSeconds(30);

    public void validate() {
        if (maxContextChars < MIN_CONTEXT_CHARS) {
            throw new IllegalStateException("covenant.answer.max-context-chars must be at least " + MIN_CONTEXT_CHARS);
        }
        if (candidateCount <= 0) {
            throw new IllegalStateException("covenant.answer.candidate-count must be positive");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalStateException("covenant.answer.timeout must be positive");
        }
        if (fuzzyMatchThreshold <= 0.0 || fuzzyMatchThreshold > 1.0) {
            throw new IllegalStateException("covenant.answer.fuzzy-match-threshold must be in (0, 1]");
        }
    }

    public int getMaxContextChars() {
        return maxContextChars;
    }

    public void setMaxContextChars(int maxContextChars) {
        this.maxContextChars = maxContextChars;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public void setCandidateCount(int candidateCount) {
        this.candidateCount = candidateCount;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public boolean isLlmSpanMatchEnabled() {
        return llmSpanMatchEnabled;
    }

    public void setLlmSpanMatchEnabled(boolean llmSpanMatchEnabled) {
        this.llmSpanMatchEnabled = llmSpanMatchEnabled;
    }

    public double getFuzzyMatchThreshold() {
        return fuzzyMatchThreshold;
    }

    public void setFuzzyMatchThreshold(double fuzzyMatchThreshold) {
        this.fuzzyMatchThreshold = fuzzyMatchThreshold;
    }

    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    public void setCircuitFailureThreshold(int circuitFailureThreshold) {
        this.circuitFailureThreshold = circuitFailureThreshold;
    }

    public Duration getCircuitOpenDuration() {
        return circuitOpenDuration;
    }

    public void setCircuitOpenDuration(Duration circuitOpenDuration) {
        this.circuitOpenDuration = circuitOpenDuration;
    }
}
