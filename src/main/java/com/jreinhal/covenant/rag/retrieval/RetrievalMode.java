package com.jreinhal.covenant.rag.retrieval;

/**
 * Which index signals feed a search. The single-signal modes exist for evaluation and obey the
 * same relevance floor as {@link #HYBRID}.
 */
public enum RetrievalMode {
    HYBRID,
    VECTOR_ONLY,
    LEXICAL_ONLY;

    public boolean usesVector() {
        return this != LEXICAL_ONLY;
    }

    public boolean usesLexical() {
        return this != VECTOR_ONLY;
    }

    public static RetrievalMode fromParam(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (RetrievalMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown retrieval mode: " + value);
    }
}
