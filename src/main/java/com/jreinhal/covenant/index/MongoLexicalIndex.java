package com.jreinhal.covenant.index;

import com.mongodb.client.result.DeleteResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

/**
 * BM25 index over the {@code chunk_terms} collection.
 *
 * <p>Each entry keeps the chunk's distinct terms, used to find candidates,
 * and its term frequencies as a list of postings, since terms such as {@code $55.00} are not
 * valid Mongo field names. Corpus statistics are read at query time, so a chunk is scored
 * against the corpus as it is when the query runs.</p>
 */
@Repository
public class MongoLexicalIndex implements LexicalIndex {
    private static final Logger log = LoggerFactory.getLogger(MongoLexicalIndex.class);
    private static final String COLLECTION_NAME = "chunk_terms";

    private final MongoTemplate mongoTemplate;

    public MongoLexicalIndex(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void upsert(String chunkId, String documentId, String text) {
        List<String> tokens = Tokenizer.tokenize(text);
        Map<String, Integer> freqs = new LinkedHashMap<>();
        for (String token : tokens) {
            freqs.merge(token, 1, Integer::sum);
        }
        List<Posting> postings = new ArrayList<>(freqs.size());
        freqs.forEach((term, count) -> postings.add(new Posting(term, count)));

        TermEntry entry = new TermEntry();
        entry.setId(chunkId);
        entry.setDocumentId(documentId);
        entry.setTerms(new ArrayList<>(freqs.keySet()));
        entry.setPostings(postings);
        entry.setLength(tokens.size());
        this.mongoTemplate.save(entry, COLLECTION_NAME);
    }

    @Override
    public List<LexicalHit> query(String text, int k, String documentId) {
        List<String> queryTerms = Tokenizer.distinctTerms(text);
        if (queryTerms.isEmpty() || k <= 0) {
            return List.of();
        }
        Criteria criteria = Criteria.where("terms").in(queryTerms);
        if (documentId != null) {
            criteria = criteria.and("documentId").is(documentId);
        }
        List<TermEntry> candidates = this.mongoTemplate.find(new Query(criteria), TermEntry.class, COLLECTION_NAME);
        if (candidates.isEmpty()) {
            return List.of();
        }
        Bm25Scorer.CorpusStats stats = this.corpusStats(queryTerms);
        List<LexicalHit> hits = new ArrayList<>(candidates.size());
        for (TermEntry entry : candidates) {
            double score = Bm25Scorer.score(queryTerms, entry.termFrequencies(), entry.getLength(), stats);
            if (score > 0.0) {
                hits.add(new LexicalHit(entry.getId(), entry.getDocumentId(), score));
            }
        }
        log.debug("Lexical query matched {} of {} candidate chunks", hits.size(), candidates.size());
        return hits.stream()
                .sorted(Comparator.comparingDouble(LexicalHit::score).reversed().thenComparing(LexicalHit::chunkId))
                .limit(k)
                .toList();
    }

    private Bm25Scorer.CorpusStats corpusStats(List<String> queryTerms) {
        long documentCount = this.mongoTemplate.count(new Query(), COLLECTION_NAME);
        double averageLength = 0.0;
        LengthStats lengthStats = this.mongoTemplate.aggregate(
                Aggregation.newAggregation(Aggregation.group().avg("length").as("averageLength")),
                COLLECTION_NAME, LengthStats.class).getUniqueMappedResult();
        if (lengthStats != null && lengthStats.getAverageLength() != null) {
            averageLength = lengthStats.getAverageLength();
        }
        Map<String, Long> documentFrequencies = new HashMap<>();
        for (String term : queryTerms) {
            documentFrequencies.put(term, this.mongoTemplate.count(new Query(Criteria.where("terms").is(term)), COLLECTION_NAME));
        }
        return new Bm25Scorer.CorpusStats(documentCount, averageLength, documentFrequencies);
    }

    @Override
    public long deleteByDocument(String documentId) {
        DeleteResult result = this.mongoTemplate.remove(new Query(Criteria.where("documentId").is(documentId)), COLLECTION_NAME);
        log.debug("Deleted {} lexical entries", result.getDeletedCount());
        return result.getDeletedCount();
    }

    @Override
    public long countByDocument(String documentId) {
        return this.mongoTemplate.count(new Query(Criteria.where("documentId").is(documentId)), COLLECTION_NAME);
    }

    public record Posting(String term, int count) {
    }

    public static class TermEntry {
        @Id
        private String id;
        private String documentId;
        private List<String> terms;
        private List<Posting> postings;
        private int length;

        Map<String, Integer> termFrequencies() {
            Map<String, Integer> freqs = new HashMap<>();
            if (this.postings != null) {
                for (Posting posting : this.postings) {
                    freqs.put(posting.term(), posting.count());
                }
            }
            return freqs;
        }

        public String getId() {
            return this.id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getDocumentId() {
            return this.documentId;
        }

        public void setDocumentId(String documentId) {
            this.documentId = documentId;
        }

        public List<String> getTerms() {
            return this.terms;
        }

        public void setTerms(List<String> terms) {
            this.terms = terms;
        }

        public List<Posting> getPostings() {
            return this.postings;
        }

        public void setPostings(List<Posting> postings) {
            this.postings = postings;
        }

        public int getLength() {
            return this.length;
        }

        public void setLength(int length) {
            this.length = length;
        }
    }

    public static class LengthStats {
        private Double averageLength;

        public Double getAverageLength() {
            return this.averageLength;
        }

        public void setAverageLength(Double averageLength) {
            this.averageLength = averageLength;
        }
    }
}
