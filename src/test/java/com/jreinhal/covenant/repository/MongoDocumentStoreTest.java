package com.jreinhal.covenant.repository;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.ContractMetadata;
import com.jreinhal.covenant.model.ContractMetadata.Span;
import com.jreinhal.covenant.model.DocumentStatus;
import com.mongodb.client.result.UpdateResult;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

@ExtendWith(MockitoExtension.class)
class MongoDocumentStoreTest {

    @Mock
    private MongoTemplate mongoTemplate;

    private MongoDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDocumentStore(mongoTemplate);
    }

    @Test
    void testTransitionIsConditionalOnCurrentStatus() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ContractDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        assertTrue(store.transition("nda", EnumSet.of(DocumentStatus.EXTRACTING), DocumentStatus.CHUNKING));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(ContractDocument.class));
        Document filter = query.getValue().getQueryObject();
        assertEquals("nda", filter.get("_id"));
        assertTrue(((Collection<?>) ((Document) filter.get("status")).get("$in")).contains(DocumentStatus.EXTRACTING));
        assertEquals(DocumentStatus.CHUNKING, ((Document) update.getValue().getUpdateObject().get("$set")).get("status"));
    }

    @Test
    void testTransitionMissesWhenStatusMoved() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ContractDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertFalse(store.transition("nda", EnumSet.of(DocumentStatus.EMBEDDING), DocumentStatus.INDEXED));
    }

    @Test
    void testMarkFailedNeverRevivesTombstone() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ContractDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        assertTrue(store.markFailed("nda", "Embedding failed after 4 attempts", 7));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(ContractDocument.class));
        Collection<?> allowed = (Collection<?>) ((Document) query.getValue().getQueryObject().get("status")).get("$in");
        assertFalse(allowed.contains(DocumentStatus.DELETED));
        assertTrue(allowed.contains(DocumentStatus.EMBEDDING));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertEquals(DocumentStatus.FAILED, set.get("status"));
        assertEquals(7, set.get("failedChunkIndex"));
        assertEquals(0, set.get("chunkCount"));
    }

    @Test
    void testMarkIndexedClearsFailure() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ContractDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        store.markIndexed("nda", 12);

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(ContractDocument.class));
        assertEquals(DocumentStatus.EMBEDDING, query.getValue().getQueryObject().get("status"));
        Document unset = (Document) update.getValue().getUpdateObject().get("$unset");
        assertTrue(unset.containsKey("failureReason"));
        assertTrue(unset.containsKey("failedChunkIndex"));
    }

    @Test
    void testMetadataIsRecordedOnlyWhileChunking() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ContractDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));
        ContractMetadata metadata = new ContractMetadata(List.of(), LocalDate.of(2024, 3, 1), new Span(10, 34),
                null, null, true, new Span(0, 6), 36, new Span(50, 80), null, null);

        assertFalse(store.recordMetadata("nda", metadata));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(ContractDocument.class));
        assertEquals("nda", query.getValue().getQueryObject().get("_id"));
        assertEquals(DocumentStatus.CHUNKING, query.getValue().getQueryObject().get("status"));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertSame(metadata, set.get("metadata"));
        assertTrue(set.containsKey("updatedAt"));
    }

    @Test
    void testTransitionAllReportsMovedIds() {
        ContractDocument moved = new ContractDocument();
        moved.setId("a");
        when(mongoTemplate.updateMulti(any(Query.class), any(Update.class), eq(ContractDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        when(mongoTemplate.find(any(Query.class), eq(ContractDocument.class))).thenReturn(List.of(moved));

        List<String> ids = store.transitionAll(List.of("a", "b"),
                EnumSet.of(DocumentStatus.INDEXED, DocumentStatus.FAILED), DocumentStatus.EXTRACTING);

        assertEquals(List.of("a"), ids);
    }

    @Test
    void testTransitionAllWithNoIds() {
        assertEquals(List.of(), store.transitionAll(List.of(), EnumSet.of(DocumentStatus.INDEXED), DocumentStatus.EXTRACTING));
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void testContentHashLookupIgnoresTombstones() {
        store.findByContentHash("abc123");

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).findOne(query.capture(), eq(ContractDocument.class));
        Document filter = query.getValue().getQueryObject();
        assertEquals("abc123", filter.get("contentHash"));
        assertEquals(DocumentStatus.DELETED, ((Document) filter.get("status")).get("$ne"));
    }
}
