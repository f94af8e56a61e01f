package com.jreinhal.covenant.index;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.jreinhal.covenant.index.LexicalIndex.LexicalHit;
import com.jreinhal.covenant.index.MongoLexicalIndex.LengthStats;
import com.jreinhal.covenant.index.MongoLexicalIndex.Posting;
import com.jreinhal.covenant.index.MongoLexicalIndex.TermEntry;
import com.mongodb.client.result.DeleteResult;
import java.util.ArrayList;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Query;

class MongoLexicalIndexTest {

    private MongoTemplate mongoTemplate;
    private MongoLexicalIndex index;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        index = new MongoLexicalIndex(mongoTemplate);
    }

    @Test
    void testUpsertStoresTermsAndPostings() {
        index.upsert("grounds:0", "grounds", "Weeding at $55.00 per man, per man hour");

        ArgumentCaptor<TermEntry> captor = ArgumentCaptor.forClass(TermEntry.class);
        verify(mongoTemplate).save(captor.capture(), eq("chunk_terms"));
        TermEntry entry = captor.getValue();
        assertEquals("grounds:0", entry.getId());
        assertEquals("grounds", entry.getDocumentId());
        assertEquals(List.of("weeding", "$55.00", "55.00", "per", "man", "hour"), entry.getTerms());
        assertTrue(entry.getPostings().contains(new Posting("man", 2)));
        assertTrue(entry.getPostings().contains(new Posting("$55.00", 1)));
        assertEquals(8, entry.getLength());
    }

    @Test
    void testQueryRanksByBm25() {
        List<TermEntry> stored = List.of(
                entry("grounds:0", "grounds", "weeding is billed at $55.00 per man hour"),
                entry("fees:0", "fees", "hourly labor charges are billed monthly"),
                entry("fees:1", "fees", "weeding weeding weeding"));
        when(mongoTemplate.find(any(Query.class), eq(TermEntry.class), eq("chunk_terms"))).thenReturn(stored);
        stubCorpus(20L, 8.0, 2L);

        List<LexicalHit> hits = index.query("weeding per man hour", 10, null);

        assertEquals(List.of("grounds:0", "fees:1"), hits.stream().map(LexicalHit::chunkId).toList());
        assertTrue(hits.get(0).score() > hits.get(1).score());
    }

    @Test
    void testQueryHonoursLimitAndDocumentFilter() {
        when(mongoTemplate.find(any(Query.class), eq(TermEntry.class), eq("chunk_terms"))).thenReturn(List.of(
                entry("grounds:0", "grounds", "weeding rate"),
                entry("grounds:1", "grounds", "weeding schedule")));
        stubCorpus(5L, 2.0, 2L);

        List<LexicalHit> hits = index.query("weeding", 1, "grounds");

        assertEquals(1, hits.size());
        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(captor.capture(), eq(TermEntry.class), eq("chunk_terms"));
        assertEquals("grounds", captor.getValue().getQueryObject().get("documentId"));
    }

    @Test
    void testStopWordOnlyQueryDoesNotTouchTheStore() {
        assertTrue(index.query("what is the", 10, null).isEmpty());
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void testDeleteByDocument() {
        when(mongoTemplate.remove(any(Query.class), eq("chunk_terms"))).thenReturn(DeleteResult.acknowledged(4));

        assertEquals(4, index.deleteByDocument("grounds"));
    }

    private void stubCorpus(long documentCount, double averageLength, long documentFrequency) {
        when(mongoTemplate.count(any(Query.class), eq("chunk_terms"))).thenAnswer(invocation -> {
            Query query = invocation.getArgument(0);
            return query.getQueryObject().isEmpty() ? documentCount : documentFrequency;
        });
        LengthStats stats = new LengthStats();
        stats.setAverageLength(averageLength);
        when(mongoTemplate.aggregate(any(Aggregation.class), eq("chunk_terms"), eq(LengthStats.class)))
                .thenReturn(new AggregationResults<>(List.of(stats), new Document()));
    }

    private static TermEntry entry(String chunkId, String documentId, String text) {
        List<String> tokens = Tokenizer.tokenize(text);
        List<Posting> postings = new ArrayList<>();
        for (String term : Tokenizer.distinctTerms(text)) {
            postings.add(new Posting(term, (int) tokens.stream().filter(term::equals).count()));
        }
        TermEntry entry = new TermEntry();
        entry.setId(chunkId);
        entry.setDocumentId(documentId);
        entry.setTerms(Tokenizer.distinctTerms(text));
        entry.setPostings(postings);
        entry.setLength(tokens.size());
        return entry;
    }
}
