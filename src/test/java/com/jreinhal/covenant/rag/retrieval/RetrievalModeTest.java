package com.jreinhal.covenant.rag.retrieval;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RetrievalModeTest {

    @Test
    void testFromParam() {
        assertEquals(RetrievalMode.HYBRID, RetrievalMode.fromParam(null));
        assertEquals(RetrievalMode.HYBRID, RetrievalMode.fromParam(" "));
        assertEquals(RetrievalMode.VECTOR_ONLY, RetrievalMode.fromParam("vector-only"));
        assertEquals(RetrievalMode.LEXICAL_ONLY, RetrievalMode.fromParam("LEXICAL_ONLY"));
        assertThrows(IllegalArgumentException.class, () -> RetrievalMode.fromParam("semantic"));
    }

    @Test
    void testLegsPerMode() {
        assertTrue(RetrievalMode.HYBRID.usesVector() && RetrievalMode.HYBRID.usesLexical());
        assertFalse(RetrievalMode.VECTOR_ONLY.usesLexical());
        assertFalse(RetrievalMode.LEXICAL_ONLY.usesVector());
    }
}
