package com.jreinhal.covenant.controller;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.jreinhal.covenant.exception.AnswerUnavailableException;
import com.jreinhal.covenant.exception.GlobalExceptionHandler;
import com.jreinhal.covenant.exception.RetrievalUnavailableException;
import com.jreinhal.covenant.model.AnswerResult;
import com.jreinhal.covenant.model.Citation;
import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.model.RetrievalCandidate;
import com.jreinhal.covenant.rag.answer.AnswerSynthesisService;
import com.jreinhal.covenant.rag.retrieval.HybridRetrievalService;
import com.jreinhal.covenant.rag.retrieval.RetrievalMode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class RetrievalControllerTest {

    @Mock
    private HybridRetrievalService retrievalService;

    @Mock
    private AnswerSynthesisService answerService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RetrievalController(retrievalService, answerService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testSearchPassesParameters() throws Exception {
        DocumentChunk chunk = new DocumentChunk("msa", 3, 2, 2, 1800, 2400, "Labor is billed at $55.00 per man hour.");
        RetrievalCandidate candidate = new RetrievalCandidate(chunk, 0.21, 4.7, 1, 1, 2.0 / 61, 1);
        when(retrievalService.search("man hour rate", 5, "msa", RetrievalMode.LEXICAL_ONLY)).thenReturn(List.of(candidate));

        mockMvc.perform(get("/api/search")
                        .param("q", "man hour rate")
                        .param("n", "5")
                        .param("documentId", " msa ")
                        .param("mode", "lexical-only"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].chunk.documentId").value("msa"))
                .andExpect(jsonPath("$[0].lexicalRank").value(1))
                .andExpect(jsonPath("$[0].fusedRank").value(1));
    }

    @Test
    void testSearchDefaults() throws Exception {
        when(retrievalService.search("term", 0, null, RetrievalMode.HYBRID)).thenReturn(List.of());

        mockMvc.perform(get("/api/search").param("q", "term").param("documentId", ""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void testBadSearchRequests() throws Exception {
        mockMvc.perform(get("/api/search")).andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/search").param("q", "x").param("n", "ten")).andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/search").param("q", "x").param("mode", "semantic"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown retrieval mode: semantic"));
        verifyNoInteractions(retrievalService);
    }

    @Test
    void testSearchUnavailable() throws Exception {
        when(retrievalService.search(anyString(), anyInt(), any(), any()))
                .thenThrow(new RetrievalUnavailableException("both indexes down"));

        mockMvc.perform(get("/api/search").param("q", "term"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Search is temporarily unavailable"));
    }

    @Test
    void testAnswerWithCitations() throws Exception {
        Citation citation = new Citation("msa", 2, "7", 1812, 1832, "$55.00 per man hour", "msa#3",
                Citation.MatchMethod.EXACT);
        when(answerService.answer("What is the labor rate?", "msa"))
                .thenReturn(new AnswerResult("Labor is billed at $55.00 per man hour [1].", List.of(citation), true, 4));

        mockMvc.perform(post("/api/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is the labor rate?\",\"documentId\":\"msa\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evidenceFound").value(true))
                .andExpect(jsonPath("$.citations[0].spanStart").value(1812))
                .andExpect(jsonPath("$.citations[0].matchMethod").value("EXACT"));
    }

    @Test
    void testNoEvidenceAnswer() throws Exception {
        when(answerService.answer("Who owns the moon?", null)).thenReturn(AnswerResult.noEvidence());

        mockMvc.perform(post("/api/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Who owns the moon?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evidenceFound").value(false))
                .andExpect(jsonPath("$.text").value(AnswerResult.NO_EVIDENCE_TEXT))
                .andExpect(jsonPath("$.citations").isEmpty());
    }

    @Test
    void testAnswerUnavailable() throws Exception {
        when(answerService.answer(anyString(), any())).thenThrow(new AnswerUnavailableException("Language model timed out"));

        mockMvc.perform(post("/api/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Term?\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Couldn't generate an answer right now"));
    }

    @Test
    void testMalformedAnswerBody() throws Exception {
        mockMvc.perform(post("/api/answer").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request"));
    }
}
