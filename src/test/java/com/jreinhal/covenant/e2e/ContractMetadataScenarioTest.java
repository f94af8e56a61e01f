package com.jreinhal.covenant.e2e;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.covenant.model.AnswerResult;
import com.jreinhal.covenant.model.Citation;
import com.jreinhal.covenant.model.ContractMetadata;
import com.jreinhal.covenant.model.ContractMetadata.Party;
import com.jreinhal.covenant.model.RetrievalCandidate;
import com.jreinhal.covenant.rag.retrieval.RetrievalMode;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

class ContractMetadataScenarioTest {

    private static final String NDA = "MUTUAL NON-DISCLOSURE AGREEMENT\n\n"
            + "This Agreement is made as of March 1, 2024 by and between Acme Corporation (\"Disclosing Party\") "
            + "and Globex Limited (\"Receiving Party\").\n\n"
            + "1. Term. This Agreement remains in force for three years from the Effective Date.\n\n"
            + "2. Governing Law. This Agreement is governed by the laws of the State of Delaware.";

    private PipelineFixture pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new PipelineFixture();
        pipeline.ingestText("nda", NDA);
        pipeline.ingestText("invoice", "8. Invoices. Fees are due within thirty days of invoice.");
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    void metadataIsStoredWhenTheDocumentIsChunked() {
        ContractMetadata metadata = pipeline.documentStore.findById("nda").orElseThrow().getMetadata();

        assertNotNull(metadata);
        assertEquals(List.of("Acme Corporation", "Globex Limited"), metadata.parties().stream().map(Party::name).toList());
        assertEquals(LocalDate.of(2024, 3, 1), metadata.effectiveDate());
        assertEquals("State of Delaware", metadata.governingLaw());
        assertEquals(36, metadata.termMonths());
        assertTrue(metadata.mutual());
        assertFalse(pipeline.documentStore.findById("invoice").orElseThrow().getMetadata().hasFacts());
    }

    @Test
    @DisplayName("Governing law is answered from metadata with a citation into the contract, without the model")
    void governingLawAnsweredFromMetadata() {
        StubChatModel chatModel = new StubChatModel("should never be used");

        AnswerResult result = pipeline.answerService(chatModel).answer("What law governs this agreement?", "nda");

        assertEquals(0, chatModel.calls.get());
        assertEquals("The agreement is governed by the laws of the State of Delaware.", result.text());
        Citation citation = result.citations().get(0);
        assertEquals(Citation.MatchMethod.METADATA, citation.matchMethod());
        assertEquals(1, citation.pageNum());
        assertEquals(NDA.indexOf("governed by"), citation.spanStart());
        assertEquals(NDA.substring(citation.spanStart(), citation.spanEnd()), citation.excerpt());
    }

    @Test
    void expirationIsDerivedFromDateAndTerm() {
        StubChatModel chatModel = new StubChatModel("should never be used");

        AnswerResult result = pipeline.answerService(chatModel).answer("When does this NDA expire?", "nda");

        assertEquals("The agreement expires on March 1, 2027, 3 years after its effective date of March 1, 2024.",
                result.text());
        assertEquals(2, result.citations().size());
        assertEquals(0, chatModel.calls.get());
    }

    @Test
    @DisplayName("Clause questions still go through retrieval and the model")
    void clauseQuestionUsesRetrieval() {
        StubChatModel chatModel = new StubChatModel(
                "Delaware law applies [E1: \"governed by the laws of the State of Delaware\"].");

        AnswerResult result = pipeline.answerService(chatModel).answer("What does the governing law clause say?", "nda");

        assertEquals(1, chatModel.calls.get());
        assertEquals(Citation.MatchMethod.EXACT, result.citations().get(0).matchMethod());
        assertEquals(NDA.indexOf("governed by"), result.citations().get(0).spanStart());
    }

    @Test
    @DisplayName("Keyword search finds the governing law clause for a question that only says \"jurisdiction\"")
    void jurisdictionQuestionReachesGoverningLawClause() {
        List<RetrievalCandidate> hits = pipeline.retrievalService.search("Which jurisdiction applies?", 5, null,
                RetrievalMode.LEXICAL_ONLY);

        assertFalse(hits.isEmpty());
        assertTrue(hits.stream().allMatch(c -> c.documentId().equals("nda")));
        assertTrue(hits.get(0).chunk().getText().contains("Governing Law"));
    }

    private static final class StubChatModel implements ChatModel {
        private final String reply;
        private final AtomicInteger calls = new AtomicInteger();

        private StubChatModel(String reply) {
            this.reply = reply;
        }

        @Override
        public ChatResponse call(Prompt prompt) {
            calls.incrementAndGet();
            return new ChatResponse(List.of(new Generation(new AssistantMessage(reply))));
        }
    }
}
