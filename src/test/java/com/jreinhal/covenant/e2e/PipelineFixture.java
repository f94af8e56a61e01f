package com.jreinhal.covenant.e2e;

import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.Mockito.mock;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.covenant.config.AnswerProperties;
import com.jreinhal.covenant.config.ChunkingProperties;
import com.jreinhal.covenant.config.EmbeddingProperties;
import com.jreinhal.covenant.config.ExecutorConfig;
import com.jreinhal.covenant.config.IngestionProperties;
import com.jreinhal.covenant.config.RetrievalProperties;
import com.jreinhal.covenant.index.DualIndexWriter;
import com.jreinhal.covenant.ingest.IngestionOrchestrator;
import com.jreinhal.covenant.ingest.IngestionProgressTracker;
import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.rag.answer.AnswerSynthesisService;
import com.jreinhal.covenant.rag.answer.CitationResolver;
import com.jreinhal.covenant.rag.answer.ContextWindowBuilder;
import com.jreinhal.covenant.rag.answer.MetadataAnswerer;
import com.jreinhal.covenant.rag.answer.ModelAssistedSpanMatcher;
import com.jreinhal.covenant.rag.chunking.ClauseTagger;
import com.jreinhal.covenant.rag.chunking.ContractMetadataExtractor;
import com.jreinhal.covenant.rag.chunking.SlidingWindowChunker;
import com.jreinhal.covenant.rag.retrieval.HybridRetrievalService;
import com.jreinhal.covenant.rag.retrieval.QueryNormalizer;
import com.jreinhal.covenant.service.DocumentTextExtractor;
import com.jreinhal.covenant.service.EmbeddingGenerator;
import com.jreinhal.covenant.service.OcrService;
import com.jreinhal.covenant.service.PageRenderService;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.support.ExecutorServiceAdapter;

/**
 * The ingestion and retrieval pipeline wired from production classes over in-memory stores.
 * Ingestion runs on a real worker pool; retrieval and model calls run on the caller thread.
 */
public class PipelineFixture implements AutoCloseable {
    public static final Set<DocumentStatus> TERMINAL = EnumSet.of(DocumentStatus.INDEXED, DocumentStatus.FAILED);
    private static final Executor DIRECT = Runnable::run;
    private static final ExecutorService DIRECT_MODEL_CALLS = new ExecutorServiceAdapter(new SyncTaskExecutor());

    public final InMemoryDocumentStore documentStore = new InMemoryDocumentStore();
    public final InMemoryChunkStore chunkStore = new InMemoryChunkStore();
    public final InMemoryContentStore contentStore = new InMemoryContentStore();
    public final InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex();
    public final InMemoryLexicalIndex lexicalIndex = new InMemoryLexicalIndex();
    public final ConceptEmbeddingModel embeddingModel = new ConceptEmbeddingModel();
    public final OcrService ocrService = mock(OcrService.class);
    public final PageRenderService pageRenderService = mock(PageRenderService.class);

    public final ChunkingProperties chunkingProperties = new ChunkingProperties();
    public final IngestionProperties ingestionProperties = new IngestionProperties();
    public final EmbeddingProperties embeddingProperties = new EmbeddingProperties();
    public final RetrievalProperties retrievalProperties = new RetrievalProperties();
    public final AnswerProperties answerProperties = new AnswerProperties();

    public final ThreadPoolExecutor ingestionExecutor;
    public final EmbeddingGenerator embeddingGenerator;
    public final DualIndexWriter indexWriter;
    public final IngestionProgressTracker progressTracker = new IngestionProgressTracker();
    public final QueryNormalizer queryNormalizer = new QueryNormalizer();
    public final IngestionOrchestrator orchestrator;
    public final HybridRetrievalService retrievalService;

    public PipelineFixture() {
        this.embeddingProperties.setModelId("concept-test");
        this.embeddingProperties.setInitialBackoff(Duration.ofMillis(1));
        this.embeddingProperties.setMaxBackoff(Duration.ofMillis(4));
        this.embeddingProperties.setTimeout(Duration.ofSeconds(15));
        this.embeddingProperties.setContextualPrefix(false);

        this.ingestionExecutor = new ExecutorConfig().ingestionExecutor(this.ingestionProperties);
        this.embeddingGenerator = new EmbeddingGenerator(this.embeddingModel, this.embeddingProperties, DIRECT_MODEL_CALLS,
                Caffeine.newBuilder().maximumSize(100).<String, float[]>build());
        this.indexWriter = new DualIndexWriter(this.vectorIndex, this.lexicalIndex);
        DocumentTextExtractor extractor = new DocumentTextExtractor(this.ocrService, this.pageRenderService,
                this.ingestionProperties);
        SlidingWindowChunker chunker = new SlidingWindowChunker(this.chunkingProperties, new ClauseTagger());
        this.orchestrator = new IngestionOrchestrator(this.documentStore, this.chunkStore, this.contentStore, extractor,
                chunker, new ContractMetadataExtractor(), this.embeddingGenerator, this.indexWriter, this.progressTracker,
                this.ingestionExecutor);
        this.retrievalService = new HybridRetrievalService(this.vectorIndex, this.lexicalIndex, this.embeddingGenerator,
                this.chunkStore, this.documentStore, this.retrievalProperties, DIRECT, this.queryNormalizer);
    }

    public AnswerSynthesisService answerService(ChatModel chatModel) {
        ChatClient.Builder builder = ChatClient.builder(chatModel);
        ModelAssistedSpanMatcher matcher = new ModelAssistedSpanMatcher(builder, this.answerProperties, DIRECT_MODEL_CALLS);
        CitationResolver resolver = new CitationResolver(this.answerProperties, matcher);
        return new AnswerSynthesisService(this.retrievalService, new ContextWindowBuilder(), resolver, builder,
                this.answerProperties, DIRECT_MODEL_CALLS,
                new MetadataAnswerer(this.documentStore, this.chunkStore, this.queryNormalizer));
    }

    /**
     * Polls the store until the document reaches one of {@code expected}.
     */
    public ContractDocument awaitStatus(String documentId, Set<DocumentStatus> expected) {
        long deadline = System.currentTimeMillis() + 10_000L;
        while (System.currentTimeMillis() < deadline) {
            ContractDocument document = this.documentStore.findById(documentId).orElse(null);
            if (document != null && expected.contains(document.getStatus())) {
                return document;
            }
            sleep(10);
        }
        return fail("Document " + documentId + " did not reach " + expected);
    }

    /**
     * Waits until no worker holds a document and the progress run is over.
     */
    public void awaitIdle() {
        long deadline = System.currentTimeMillis() + 10_000L;
        while (System.currentTimeMillis() < deadline) {
            if (this.orchestrator.getActiveJobs().isEmpty() && !this.orchestrator.getProgress().running()
                    && !this.orchestrator.isReindexRunning()) {
                return;
            }
            sleep(10);
        }
        fail("Ingestion did not go idle");
    }

    public ContractDocument ingestText(String documentId, String text) {
        this.orchestrator.ingest(documentId, documentId + ".txt", text.getBytes(StandardCharsets.UTF_8), "text/plain");
        ContractDocument document = this.awaitStatus(documentId, TERMINAL);
        this.awaitIdle();
        return document;
    }

    @Override
    public void close() {
        this.ingestionExecutor.shutdownNow();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
