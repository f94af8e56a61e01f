package com.jreinhal.covenant.rag.answer;

import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.model.RetrievalCandidate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Lays candidates out as labelled excerpts ({@code [E1]}, {@code [E2]}, ...) in fused-rank
 * order until the character budget is spent. The first excerpt is truncated to fit when it
 * alone exceeds the budget; later excerpts are included whole or not at all.
 */
@Component
public class ContextWindowBuilder {
    private static final String EXCERPT_SEPARATOR = "\n\n";

    public ContextWindow build(List<RetrievalCandidate> candidates, int maxChars) {
        StringBuilder context = new StringBuilder();
        List<Excerpt> excerpts = new ArrayList<>();
        for (RetrievalCandidate candidate : candidates) {
            String label = "E" + (excerpts.size() + 1);
            String header = header(label, candidate.chunk());
            String text = candidate.chunk().getText();
            int needed = header.length() + 1 + text.length() + EXCERPT_SEPARATOR.length();
            if (context.length() + needed > maxChars) {
                int room = maxChars - context.length() - header.length() - 1 - EXCERPT_SEPARATOR.length();
                if (!excerpts.isEmpty() || room <= 0) {
                    break;
                }
                text = text.substring(0, room);
            }
            context.append(header).append('\n').append(text).append(EXCERPT_SEPARATOR);
            excerpts.add(new Excerpt(label, candidate, text));
        }
        return new ContextWindow(context.toString().strip(), excerpts);
    }

    static String header(String label, DocumentChunk chunk) {
        StringBuilder header = new StringBuilder();
        header.append('[').append(label).append("] Document: ").append(chunk.getDocumentId())
                .append(" | Page ").append(chunk.getPageNum());
        if (chunk.getClauseNumber() != null || chunk.getClauseTitle() != null) {
            header.append(" | Clause");
            if (chunk.getClauseNumber() != null) {
                header.append(' ').append(chunk.getClauseNumber());
            }
            if (chunk.getClauseTitle() != null) {
                header.append(" (").append(chunk.getClauseTitle()).append(')');
            }
        }
        return header.toString();
    }

    public record ContextWindow(String text, List<Excerpt> excerpts) {
        public ContextWindow {
            excerpts = List.copyOf(excerpts);
        }

        public Excerpt byLabel(int number) {
            return number >= 1 && number <= this.excerpts.size() ? this.excerpts.get(number - 1) : null;
        }
    }

    /**
     * @param text the excerpt text as shown to the model, a prefix of the chunk text
     */
    public record Excerpt(String label, RetrievalCandidate candidate, String text) {
        public DocumentChunk chunk() {
            return this.candidate.chunk();
        }
    }
}
