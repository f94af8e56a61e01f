package com.jreinhal.covenant.repository;

import com.jreinhal.covenant.config.IngestionProperties;
import java.time.Instant;
import java.util.UUID;
import org.bson.types.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

@Repository
public class MongoDocumentContentStore implements DocumentContentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoDocumentContentStore.class);
    private static final String COLLECTION_NAME = "document_contents";

    private final MongoTemplate mongoTemplate;
    private final IngestionProperties properties;

    public MongoDocumentContentStore(MongoTemplate mongoTemplate, IngestionProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.properties = properties;
    }

    @Override
    public String store(String documentId, String filename, byte[] content) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Document content is empty");
        }
        if (content.length > this.properties.getMaxContentBytes()) {
            throw new IllegalArgumentException("Document exceeds the maximum size of "
                    + this.properties.getMaxContentBytes() + " bytes");
        }
        StoredContent stored = new StoredContent();
        stored.setId(documentId + "-" + UUID.randomUUID());
        stored.setDocumentId(documentId);
        stored.setFilename(filename);
        stored.setData(new Binary(content));
        stored.setStoredAt(Instant.now());
        this.mongoTemplate.save(stored, COLLECTION_NAME);
        log.debug("Stored {} bytes of content", content.length);
        return stored.getId();
    }

    @Override
    public byte[] load(String contentRef) {
        StoredContent stored = this.mongoTemplate.findById(contentRef, StoredContent.class, COLLECTION_NAME);
        if (stored == null || stored.getData() == null) {
            throw new IllegalStateException("Stored content missing for reference " + contentRef);
        }
        return stored.getData().getData();
    }

    @Override
    public void delete(String contentRef) {
        if (contentRef == null) {
            return;
        }
        this.mongoTemplate.remove(new Query(Criteria.where("_id").is(contentRef)), COLLECTION_NAME);
    }

    public static class StoredContent {
        @Id
        private String id;
        private String documentId;
        private String filename;
        private Binary data;
        private Instant storedAt;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getDocumentId() {
            return documentId;
        }

        public void setDocumentId(String documentId) {
            this.documentId = documentId;
        }

        public String getFilename() {
            return filename;
        }

        public void setFilename(String filename) {
            this.filename = filename;
        }

        public Binary getData() {
            return data;
        }

        public void setData(Binary data) {
            this.data = data;
        }

        public Instant getStoredAt() {
            return storedAt;
        }

        public void setStoredAt(Instant storedAt) {
            this.storedAt = storedAt;
        }
    }
}
