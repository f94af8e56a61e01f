package com.jreinhal.covenant.repository;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.jreinhal.covenant.config.IngestionProperties;
import com.jreinhal.covenant.repository.MongoDocumentContentStore.StoredContent;
import org.bson.types.Binary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

@ExtendWith(MockitoExtension.class)
class MongoDocumentContentStoreTest {

    @Mock
    private MongoTemplate mongoTemplate;

    private MongoDocumentContentStore store;

    @BeforeEach
    void setUp() {
        IngestionProperties properties = new IngestionProperties();
        properties.setMaxContentBytes(8);
        store = new MongoDocumentContentStore(mongoTemplate, properties);
    }

    @Test
    void testStoreKeepsBytesUnderFreshReference() {
        String first = store.store("msa", "msa.pdf", new byte[]{1, 2, 3});
        String second = store.store("msa", "msa.pdf", new byte[]{1, 2, 3});

        assertTrue(first.startsWith("msa-"));
        assertNotEquals(first, second);
        ArgumentCaptor<StoredContent> saved = ArgumentCaptor.forClass(StoredContent.class);
        verify(mongoTemplate, times(2)).save(saved.capture(), eq("document_contents"));
        assertArrayEquals(new byte[]{1, 2, 3}, saved.getValue().getData().getData());
        assertEquals("msa", saved.getValue().getDocumentId());
    }

    @Test
    void testOversizedContentIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> store.store("big", "big.pdf", new byte[9]));

        assertTrue(e.getMessage().contains("maximum size"));
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void testLoad() {
        StoredContent stored = new StoredContent();
        stored.setData(new Binary(new byte[]{4, 5}));
        when(mongoTemplate.findById("ref-1", StoredContent.class, "document_contents")).thenReturn(stored);

        assertArrayEquals(new byte[]{4, 5}, store.load("ref-1"));
    }

    @Test
    void testLoadMissingContent() {
        assertThrows(IllegalStateException.class, () -> store.load("gone"));
    }

    @Test
    void testDeleteIgnoresNullReference() {
        store.delete(null);
        verifyNoInteractions(mongoTemplate);

        store.delete("ref-1");
        verify(mongoTemplate).remove(any(Query.class), eq("document_contents"));
    }
}
