package com.jreinhal.covenant.repository;

import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.ContractMetadata;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.model.DocumentType;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

@Repository
public class MongoDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);
    private static final Set<DocumentStatus> NOT_DELETED = EnumSet.complementOf(EnumSet.of(DocumentStatus.DELETED));

    private final MongoTemplate mongoTemplate;

    public MongoDocumentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void save(ContractDocument document) {
        document.setUpdatedAt(Instant.now());
        this.mongoTemplate.save(document);
    }

    @Override
    public Optional<ContractDocument> findById(String id) {
        return Optional.ofNullable(this.mongoTemplate.findById(id, ContractDocument.class));
    }

    @Override
    public Optional<ContractDocument> findByContentHash(String contentHash) {
        Query query = new Query(Criteria.where("contentHash").is(contentHash).and("status").ne(DocumentStatus.DELETED));
        return Optional.ofNullable(this.mongoTemplate.findOne(query, ContractDocument.class));
    }

    @Override
    public List<ContractDocument> findByStatusIn(Collection<DocumentStatus> statuses) {
        return this.mongoTemplate.find(new Query(Criteria.where("status").in(statuses)), ContractDocument.class);
    }

    @Override
    public Map<String, DocumentStatus> findStatuses(Collection<String> ids) {
        Query query = new Query(Criteria.where("_id").in(ids));
        query.fields().include("status");
        Map<String, DocumentStatus> statuses = new LinkedHashMap<>();
        for (ContractDocument document : this.mongoTemplate.find(query, ContractDocument.class)) {
            statuses.put(document.getId(), document.getStatus());
        }
        return statuses;
    }

    @Override
    public boolean transition(String id, Set<DocumentStatus> expected, DocumentStatus next) {
        Query query = new Query(Criteria.where("_id").is(id).and("status").in(expected));
        Update update = new Update().set("status", next).set("updatedAt", Instant.now());
        boolean moved = this.mongoTemplate.updateFirst(query, update, ContractDocument.class).getMatchedCount() > 0;
        if (!moved) {
            log.debug("Status transition to {} skipped for {}: not in {}", next, id, expected);
        }
        return moved;
    }

    @Override
    public List<String> transitionAll(Collection<String> ids, Set<DocumentStatus> expected, DocumentStatus next) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Query query = new Query(Criteria.where("_id").in(ids).and("status").in(expected));
        Update update = new Update().set("status", next).set("updatedAt", Instant.now());
        long modified = this.mongoTemplate.updateMulti(query, update, ContractDocument.class).getModifiedCount();
        // Callers hold exclusive claims on these ids, so any of them now in next was moved here.
        Query moved = new Query(Criteria.where("_id").in(ids).and("status").is(next));
        moved.fields().include("_id");
        List<String> movedIds = this.mongoTemplate.find(moved, ContractDocument.class).stream()
                .map(ContractDocument::getId)
                .toList();
        log.info("Bulk status change to {}: {} of {} documents moved", next, modified, ids.size());
        return movedIds;
    }

    @Override
    public boolean recordExtraction(String id, DocumentType documentType, int pageCount, int textLength, int ocrPageCount) {
        Query query = new Query(Criteria.where("_id").is(id).and("status").is(DocumentStatus.EXTRACTING));
        Update update = new Update()
                .set("documentType", documentType)
                .set("pageCount", pageCount)
                .set("textLength", textLength)
                .set("ocrPageCount", ocrPageCount)
                .set("updatedAt", Instant.now());
        return this.mongoTemplate.updateFirst(query, update, ContractDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean recordMetadata(String id, ContractMetadata metadata) {
        Query query = new Query(Criteria.where("_id").is(id).and("status").is(DocumentStatus.CHUNKING));
        Update update = new Update()
                .set("metadata", metadata)
                .set("updatedAt", Instant.now());
        return this.mongoTemplate.updateFirst(query, update, ContractDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean markIndexed(String id, int chunkCount) {
        Instant now = Instant.now();
        Query query = new Query(Criteria.where("_id").is(id).and("status").is(DocumentStatus.EMBEDDING));
        Update update = new Update()
                .set("status", DocumentStatus.INDEXED)
                .set("chunkCount", chunkCount)
                .set("indexedAt", now)
                .set("updatedAt", now)
                .unset("failureReason")
                .unset("failedChunkIndex");
        return this.mongoTemplate.updateFirst(query, update, ContractDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean markFailed(String id, String reason, Integer failedChunkIndex) {
        Query query = new Query(Criteria.where("_id").is(id).and("status").in(NOT_DELETED));
        Update update = new Update()
                .set("status", DocumentStatus.FAILED)
                .set("failureReason", reason)
                .set("chunkCount", 0)
                .set("updatedAt", Instant.now());
        if (failedChunkIndex != null) {
            update.set("failedChunkIndex", failedChunkIndex);
        } else {
            update.unset("failedChunkIndex");
        }
        return this.mongoTemplate.updateFirst(query, update, ContractDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean resetForReprocess(String id, Set<DocumentStatus> expected) {
        Query query = new Query(Criteria.where("_id").is(id).and("status").in(expected));
        Update update = new Update()
                .set("status", DocumentStatus.PENDING)
                .set("updatedAt", Instant.now())
                .unset("failureReason")
                .unset("failedChunkIndex");
        return this.mongoTemplate.updateFirst(query, update, ContractDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean markDeleted(String id) {
        return this.transition(id, NOT_DELETED, DocumentStatus.DELETED);
    }

    @Override
    public void deleteById(String id) {
        this.mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), ContractDocument.class);
    }
}
