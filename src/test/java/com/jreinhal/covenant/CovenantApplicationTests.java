package com.jreinhal.covenant;

import static org.junit.jupiter.api.Assertions.*;

import com.jreinhal.covenant.ingest.IngestionOrchestrator;
import com.jreinhal.covenant.ingest.IngestionRecovery;
import com.jreinhal.covenant.rag.answer.AnswerSynthesisService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@SpringBootTest(properties = {
        "spring.ai.model.chat=none",
        "spring.ai.model.embedding=none",
        "spring.ai.openai.api-key=test",
        "covenant.ingestion.recover-on-startup=false"
})
class CovenantApplicationTests {

    @Autowired
    private ApplicationContext context;

    @TestConfiguration
    static class ModelTestConfig {
        @Bean
        @Primary
        ChatModel chatModel() {
            return Mockito.mock(ChatModel.class);
        }

        @Bean
        @Primary
        EmbeddingModel embeddingModel() {
            return Mockito.mock(EmbeddingModel.class);
        }
    }

    @Test
    void contextLoads() {
        assertNotNull(context.getBean(IngestionOrchestrator.class));
        assertNotNull(context.getBean(AnswerSynthesisService.class));
        assertTrue(context.getBeansOfType(IngestionRecovery.class).isEmpty());
    }
}
