package com.jreinhal.covenant.index;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class Bm25ScorerTest {

    private static final Bm25Scorer.CorpusStats STATS =
            new Bm25Scorer.CorpusStats(10, 20.0, Map.of("weeding", 1L, "rate", 8L));

    @Test
    void testRareTermsOutweighCommonOnes() {
        double rare = Bm25Scorer.score(List.of("weeding"), Map.of("weeding", 1), 20, STATS);
        double common = Bm25Scorer.score(List.of("rate"), Map.of("rate", 1), 20, STATS);

        assertTrue(rare > common);
        assertTrue(common > 0.0);
    }

    @Test
    void testTermFrequencySaturates() {
        double once = Bm25Scorer.score(List.of("weeding"), Map.of("weeding", 1), 20, STATS);
        double twice = Bm25Scorer.score(List.of("weeding"), Map.of("weeding", 2), 20, STATS);
        double tenTimes = Bm25Scorer.score(List.of("weeding"), Map.of("weeding", 10), 20, STATS);

        assertTrue(twice > once);
        assertTrue(tenTimes > twice);
        assertTrue(tenTimes < once * (Bm25Scorer.K1 + 1.0));
    }

    @Test
    void testLongerChunksScoreLower() {
        double shortChunk = Bm25Scorer.score(List.of("weeding"), Map.of("weeding", 1), 10, STATS);
        double longChunk = Bm25Scorer.score(List.of("weeding"), Map.of("weeding", 1), 80, STATS);

        assertTrue(shortChunk > longChunk);
    }

    @Test
    void testNoMatchScoresZero() {
        assertEquals(0.0, Bm25Scorer.score(List.of("indemnity"), Map.of("weeding", 3), 20, STATS));
        assertEquals(0.0, Bm25Scorer.score(List.of("weeding"), Map.of("weeding", 1), 0, STATS));
        assertEquals(0.0, Bm25Scorer.score(List.of("weeding"), Map.of("weeding", 1), 5,
                new Bm25Scorer.CorpusStats(0, 0.0, Map.of())));
    }

    @Test
    void testIdfIsPositiveEvenForUbiquitousTerms() {
        assertTrue(Bm25Scorer.idf(10, 10) > 0.0);
        assertTrue(Bm25Scorer.idf(10, 1) > Bm25Scorer.idf(10, 5));
    }
}
