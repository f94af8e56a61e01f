package com.jreinhal.covenant.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EmbeddingPropertiesTest {

    private static MockEnvironment providers(String active) {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.ai.ollama.embedding.options.model", "nomic-embed-text")
                .withProperty("spring.ai.openai.embedding.options.model", "text-embedding-3-small");
        if (active != null) {
            environment.setProperty("spring.ai.model.embedding", active);
        }
        return environment;
    }

    @Test
    @DisplayName("A blank model id follows the active embedding provider")
    void testModelIdFollowsActiveProvider() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setModelId("");
        properties.setEnvironment(providers("openai"));

        assertEquals("text-embedding-3-small", properties.getModelId());

        properties.setEnvironment(providers("ollama"));
        assertEquals("nomic-embed-text", properties.getModelId());
    }

    @Test
    void testProviderDefaultsToOllama() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setEnvironment(providers(null));

        assertEquals("nomic-embed-text", properties.getModelId());
    }

    @Test
    void testExplicitModelIdWins() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setModelId("bge-m3");
        properties.setEnvironment(providers("openai"));

        assertEquals("bge-m3", properties.getModelId());
    }

    @Test
    void testUnknownProviderModelFallsBackToDefault() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setEnvironment(providers("mistral"));

        assertEquals(EmbeddingProperties.DEFAULT_MODEL_ID, properties.getModelId());
        assertEquals(EmbeddingProperties.DEFAULT_MODEL_ID, new EmbeddingProperties().getModelId());
    }
}
