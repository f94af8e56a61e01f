package com.jreinhal.covenant.rag.answer;

import com.jreinhal.covenant.config.AnswerProperties;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Last-resort citation locator: asks the language model to copy the supporting text out of
 * an excerpt. The caller must still verify the returned text against the excerpt, since the
 * model may paraphrase.
 */
@Component
public class ModelAssistedSpanMatcher {
    private static final Logger log = LoggerFactory.getLogger(ModelAssistedSpanMatcher.class);
    private static final String MATCHING_TEXT = "MATCHING_TEXT:";
    private static final int MAX_EXCERPT_CHARS = 4000;

    private final ChatClient chatClient;
    private final AnswerProperties properties;
    private final ExecutorService modelCallExecutor;

    public ModelAssistedSpanMatcher(ChatClient.Builder chatClientBuilder, AnswerProperties properties,
                                    @Qualifier("modelCallExecutor") ExecutorService modelCallExecutor) {
        this.chatClient = chatClientBuilder.build();
        this.properties = properties;
        this.modelCallExecutor = modelCallExecutor;
    }

    public boolean isEnabled() {
        return this.properties.isLlmSpanMatchEnabled();
    }

    /**
     * @return text the model claims to have copied from {@code excerpt}, empty when it found
     *         nothing or the call failed
     */
    public Optional<String> findSupportingText(String claim, String excerpt) {
        if (!this.isEnabled()) {
            return Optional.empty();
        }
        String source = excerpt.length() > MAX_EXCERPT_CHARS ? excerpt.substring(0, MAX_EXCERPT_CHARS) : excerpt;
        String prompt = AnswerPrompts.SPAN_MATCH.formatted(claim, source);
        Future<String> future;
        try {
            future = this.modelCallExecutor.submit(() -> this.chatClient.prompt().user(prompt).call().content());
        } catch (RejectedExecutionException e) {
            log.warn("Span match skipped, model call pool saturated: {}", e.getMessage());
            return Optional.empty();
        }
        try {
            return parse(future.get(this.properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Span match timed out after {}ms", this.properties.getTimeout().toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Span match failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Optional.empty();
        }
    }

    static Optional<String> parse(String response) {
        if (response == null) {
            return Optional.empty();
        }
        int idx = response.toUpperCase().indexOf(MATCHING_TEXT);
        String text = idx >= 0 ? response.substring(idx + MATCHING_TEXT.length()) : response;
        text = text.strip();
        if (text.length() >= 2 && (text.startsWith("\"") && text.endsWith("\"") || text.startsWith("“") && text.endsWith("”"))) {
            text = text.substring(1, text.length() - 1).strip();
        }
        if (text.isEmpty() || text.equalsIgnoreCase("none")) {
            return Optional.empty();
        }
        return Optional.of(text);
    }
}
