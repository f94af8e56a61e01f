package com.jreinhal.covenant.rag.retrieval;

import com.jreinhal.covenant.index.LexicalIndex.LexicalHit;
import com.jreinhal.covenant.index.VectorIndex.VectorHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges a vector ranking and a lexical ranking with reciprocal rank fusion: a chunk at 1-based
 * rank {@code r} in a list gains {@code 1 / (k + r)}, summed over both lists.
 *
 * Ties are broken by best single-list rank, then by presence in both lists, then by chunk id,
 * so the order is fully deterministic. A chunk repeated within one list counts once, at its
 * first rank.
 */
public final class ReciprocalRankFusion {

    static final Comparator<Fused> ORDER = Comparator
            .comparingDouble(Fused::fusedScore).reversed()
            .thenComparingInt(Fused::bestRank)
            .thenComparing(f -> !f.inBoth())
            .thenComparing(Fused::chunkId);

    private ReciprocalRankFusion() {
    }

    public static List<Fused> fuse(List<VectorHit> vectorHits, List<LexicalHit> lexicalHits, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("RRF constant must not be negative");
        }
        Map<String, Builder> merged = new LinkedHashMap<>();
        int rank = 0;
        for (VectorHit hit : vectorHits) {
            Builder entry = merged.computeIfAbsent(hit.chunkId(), id -> new Builder(id, hit.documentId()));
            if (entry.vectorRank == 0) {
                entry.vectorRank = ++rank;
                entry.distance = hit.distance();
            }
        }
        rank = 0;
        for (LexicalHit hit : lexicalHits) {
            Builder entry = merged.computeIfAbsent(hit.chunkId(), id -> new Builder(id, hit.documentId()));
            if (entry.lexicalRank == 0) {
                entry.lexicalRank = ++rank;
                entry.lexicalScore = hit.score();
            }
        }
        List<Fused> fused = new ArrayList<>(merged.size());
        for (Builder entry : merged.values()) {
            double score = 0.0;
            if (entry.vectorRank > 0) {
                score += 1.0 / (k + entry.vectorRank);
            }
            if (entry.lexicalRank > 0) {
                score += 1.0 / (k + entry.lexicalRank);
            }
            fused.add(new Fused(entry.chunkId, entry.documentId, entry.distance, entry.lexicalScore,
                    entry.vectorRank, entry.lexicalRank, score));
        }
        fused.sort(ORDER);
        return fused;
    }

    /**
     * @param vectorDistance {@code null} when absent from the vector list
     * @param vectorRank 1-based, 0 when absent
     * @param lexicalRank 1-based, 0 when absent
     */
    public record Fused(String chunkId, String documentId, Double vectorDistance, double lexicalScore,
                        int vectorRank, int lexicalRank, double fusedScore) {

        public boolean inBoth() {
            return this.vectorRank > 0 && this.lexicalRank > 0;
        }

        int bestRank() {
            if (this.vectorRank == 0) {
                return this.lexicalRank;
            }
            if (this.lexicalRank == 0) {
                return this.vectorRank;
            }
            return Math.min(this.vectorRank, this.lexicalRank);
        }
    }

    private static final class Builder {
        private final String chunkId;
        private final String documentId;
        private Double distance;
        private double lexicalScore;
        private int vectorRank;
        private int lexicalRank;

        private Builder(String chunkId, String documentId) {
            this.chunkId = chunkId;
            this.documentId = documentId;
        }
    }
}
