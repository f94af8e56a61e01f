package com.jreinhal.covenant.index;

import java.util.Collection;
import java.util.Map;

/**
 * Okapi BM25 with the usual {@code k1 = 1.2}, {@code b = 0.75}.
 */
public final class Bm25Scorer {
    static final double K1 = 1.2;
    static final double B = 0.75;

    private Bm25Scorer() {
    }

    /**
     * @param queryTerms distinct query terms
     * @param termFreqs term frequencies of one chunk
     * @param length number of terms in that chunk
     */
    public static double score(Collection<String> queryTerms, Map<String, Integer> termFreqs, int length, CorpusStats stats) {
        if (stats.documentCount() <= 0 || length <= 0) {
            return 0.0;
        }
        double avgLength = stats.averageLength() > 0 ? stats.averageLength() : length;
        double score = 0.0;
        for (String term : queryTerms) {
            int tf = termFreqs.getOrDefault(term, 0);
            if (tf == 0) {
                continue;
            }
            long df = Math.max(1L, stats.documentFrequencies().getOrDefault(term, 1L));
            double numerator = tf * (K1 + 1.0);
            double denominator = tf + K1 * (1.0 - B + B * (length / avgLength));
            score += idf(stats.documentCount(), df) * (numerator / denominator);
        }
        return score;
    }

    /**
     * Always positive, so any matching term contributes.
     */
    static double idf(long documentCount, long documentFrequency) {
        return Math.log(1.0 + (documentCount - documentFrequency + 0.5) / (documentFrequency + 0.5));
    }

    public record CorpusStats(long documentCount, double averageLength, Map<String, Long> documentFrequencies) {
        public CorpusStats {
            documentFrequencies = Map.copyOf(documentFrequencies);
        }
    }
}
