package com.jreinhal.covenant.vector;

import com.jreinhal.covenant.config.EmbeddingProperties;
import com.jreinhal.covenant.index.VectorIndex;
import com.mongodb.client.result.DeleteResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

/**
 * Vector index kept in the {@code chunk_vectors} collection with exact cosine search done in
 * the JVM. Each entry stores its squared norm so a query costs one dot product per entry.
 */
@Repository
public class MongoVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(MongoVectorIndex.class);
    private static final String COLLECTION_NAME = "chunk_vectors";

    private final MongoTemplate mongoTemplate;
    private final EmbeddingProperties embeddingProperties;

    public MongoVectorIndex(MongoTemplate mongoTemplate, EmbeddingProperties embeddingProperties) {
        this.mongoTemplate = mongoTemplate;
        this.embeddingProperties = embeddingProperties;
        log.info("Initialized MongoVectorIndex (collection={})", COLLECTION_NAME);
    }

    @Override
    public void upsert(String chunkId, String documentId, float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Cannot index an empty vector for chunk " + chunkId);
        }
        List<Double> embedding = new ArrayList<>(vector.length);
        for (float f : vector) {
            embedding.add((double) f);
        }
        VectorEntry entry = new VectorEntry();
        entry.setId(chunkId);
        entry.setDocumentId(documentId);
        entry.setEmbedding(embedding);
        entry.setEmbeddingNorm(computeNorm(vector));
        entry.setEmbeddingModel(this.embeddingProperties.getModelId());
        this.mongoTemplate.save(entry, COLLECTION_NAME);
    }

    @Override
    public List<VectorHit> query(float[] vector, int k, String documentId) {
        if (vector == null || vector.length == 0 || k <= 0) {
            return List.of();
        }
        double queryNorm = computeNorm(vector);
        List<VectorEntry> entries = documentId != null
                ? this.mongoTemplate.find(new Query(Criteria.where("documentId").is(documentId)), VectorEntry.class, COLLECTION_NAME)
                : this.mongoTemplate.findAll(VectorEntry.class, COLLECTION_NAME);
        int skipped = 0;
        List<VectorHit> hits = new ArrayList<>(entries.size());
        for (VectorEntry entry : entries) {
            List<Double> embedding = entry.getEmbedding();
            if (embedding == null || embedding.size() != vector.length) {
                skipped++;
                continue;
            }
            double distance = 1.0 - cosineSimilarity(vector, queryNorm, embedding, entry.getEmbeddingNorm());
            hits.add(new VectorHit(entry.getId(), entry.getDocumentId(), distance));
        }
        if (skipped > 0) {
            log.warn("Skipped {} vector entries with a dimension other than {}; reprocess them after changing embedding models",
                    skipped, vector.length);
        }
        return hits.stream()
                .sorted(Comparator.comparingDouble(VectorHit::distance).thenComparing(VectorHit::chunkId))
                .limit(k)
                .toList();
    }

    @Override
    public long deleteByDocument(String documentId) {
        DeleteResult result = this.mongoTemplate.remove(new Query(Criteria.where("documentId").is(documentId)), COLLECTION_NAME);
        log.debug("Deleted {} vector entries", result.getDeletedCount());
        return result.getDeletedCount();
    }

    @Override
    public long countByDocument(String documentId) {
        return this.mongoTemplate.count(new Query(Criteria.where("documentId").is(documentId)), COLLECTION_NAME);
    }

    static double cosineSimilarity(float[] query, double queryNorm, List<Double> embedding, Double storedNorm) {
        double docNorm = storedNorm != null ? storedNorm : computeNorm(embedding);
        if (queryNorm == 0.0 || docNorm == 0.0) {
            return 0.0;
        }
        double dotProduct = 0.0;
        for (int i = 0; i < query.length; ++i) {
            Double value = embedding.get(i);
            if (value != null) {
                dotProduct += (double) query[i] * value;
            }
        }
        return dotProduct / (Math.sqrt(queryNorm) * Math.sqrt(docNorm));
    }

    static double computeNorm(float[] embedding) {
        double sum = 0.0;
        for (float f : embedding) {
            sum += (double) f * (double) f;
        }
        return sum;
    }

    private static double computeNorm(List<Double> embedding) {
        double sum = 0.0;
        for (Double value : embedding) {
            if (value != null) {
                sum += value * value;
            }
        }
        return sum;
    }

    public static class VectorEntry {
        @Id
        private String id;
        private String documentId;
        private List<Double> embedding;
        private Double embeddingNorm;
        private String embeddingModel;

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

        public List<Double> getEmbedding() {
            return this.embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }

        public Double getEmbeddingNorm() {
            return this.embeddingNorm;
        }

        public void setEmbeddingNorm(Double embeddingNorm) {
            this.embeddingNorm = embeddingNorm;
        }

        public String getEmbeddingModel() {
            return this.embeddingModel;
        }

        public void setEmbeddingModel(String embeddingModel) {
            this.embeddingModel = embeddingModel;
        }
    }
}
