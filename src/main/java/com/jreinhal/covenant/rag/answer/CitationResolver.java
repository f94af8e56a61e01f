package com.jreinhal.covenant.rag.answer;

import com.jreinhal.covenant.config.AnswerProperties;
import com.jreinhal.covenant.model.Citation;
import com.jreinhal.covenant.model.Citation.MatchMethod;
import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.rag.answer.ContextWindowBuilder.ContextWindow;
import com.jreinhal.covenant.rag.answer.ContextWindowBuilder.Excerpt;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the model's excerpt markers ({@code [E2: "quoted words"]}) into {@link Citation}s with
 * real spans and rewrites them as numbered references ({@code [1]}).
 *
 * <p>A quote is located, in order, by exact substring in the labelled excerpt, exact substring
 * in any other excerpt, whitespace/case/punctuation-insensitive match, token-window fuzzy match
 * in the labelled excerpt, and finally by asking the model to copy the supporting text (which is
 * itself verified against the excerpt). A quote that cannot be located is dropped together with
 * its marker; no span is ever invented. A bare {@code [E2]} cites the whole excerpt.</p>
 */
@Component
public class CitationResolver {
    private static final Logger log = LoggerFactory.getLogger(CitationResolver.class);
    private static final Pattern MARKER = Pattern.compile(
            "\\[E(\\d{1,3})(?:\\s*[:,]\\s*[\"“]([^\"”\\]]{1,1000})[\"”])?\\]");
    private static final Pattern TOKEN = Pattern.compile("\\S+");
    private static final int MIN_FUZZY_TOKENS = 3;

    private final AnswerProperties properties;
    private final ModelAssistedSpanMatcher modelMatcher;

    public CitationResolver(AnswerProperties properties, ModelAssistedSpanMatcher modelMatcher) {
        this.properties = properties;
        this.modelMatcher = modelMatcher;
    }

    public Resolution resolve(String answer, ContextWindow window) {
        Matcher matcher = MARKER.matcher(answer);
        StringBuilder rewritten = new StringBuilder();
        List<Citation> citations = new ArrayList<>();
        Map<String, Integer> numbers = new HashMap<>();
        int omitted = 0;
        while (matcher.find()) {
            Excerpt excerpt = window.byLabel(Integer.parseInt(matcher.group(1)));
            Citation citation = excerpt == null ? null : this.locate(matcher.group(2), excerpt, window);
            String replacement = "";
            if (citation != null) {
                String key = citation.chunkId() + "@" + citation.spanStart() + "-" + citation.spanEnd();
                Integer number = numbers.get(key);
                if (number == null) {
                    citations.add(citation);
                    number = citations.size();
                    numbers.put(key, number);
                }
                replacement = "[" + number + "]";
            } else {
                omitted++;
            }
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rewritten);
        if (omitted > 0) {
            log.info("Dropped {} citation(s) that could not be matched to excerpt text", omitted);
        }
        String text = rewritten.toString()
                .replaceAll("[ \\t]+([.,;:!?])", "$1")
                .replaceAll("[ \\t]{2,}", " ")
                .strip();
        return new Resolution(text, citations);
    }

    private Citation locate(String quote, Excerpt excerpt, ContextWindow window) {
        DocumentChunk chunk = excerpt.chunk();
        if (quote == null || quote.isBlank()) {
            return citation(chunk, 0, chunk.getText().length(), MatchMethod.WHOLE_EXCERPT);
        }
        String trimmed = quote.strip();
        int exact = chunk.getText().indexOf(trimmed);
        if (exact >= 0) {
            return citation(chunk, exact, exact + trimmed.length(), MatchMethod.EXACT);
        }
        for (Excerpt other : window.excerpts()) {
            int found = other.chunk().getText().indexOf(trimmed);
            if (other != excerpt && found >= 0) {
                return citation(other.chunk(), found, found + trimmed.length(), MatchMethod.EXACT);
            }
        }
        for (Excerpt candidate : this.labelledFirst(excerpt, window)) {
            int[] span = normalizedFind(candidate.chunk().getText(), trimmed);
            if (span != null) {
                return citation(candidate.chunk(), span[0], span[1], MatchMethod.NORMALIZED);
            }
        }
        int[] fuzzy = fuzzyFind(chunk.getText(), trimmed, this.properties.getFuzzyMatchThreshold());
        if (fuzzy != null) {
            return citation(chunk, fuzzy[0], fuzzy[1], MatchMethod.FUZZY);
        }
        if (this.modelMatcher.isEnabled()) {
            Optional<String> copied = this.modelMatcher.findSupportingText(trimmed, excerpt.text());
            if (copied.isPresent()) {
                int[] span = normalizedFind(chunk.getText(), copied.get());
                if (span != null) {
                    return citation(chunk, span[0], span[1], MatchMethod.MODEL_ASSISTED);
                }
                log.debug("Model-assisted span was not found verbatim in the excerpt");
            }
        }
        return null;
    }

    private List<Excerpt> labelledFirst(Excerpt labelled, ContextWindow window) {
        List<Excerpt> ordered = new ArrayList<>(window.excerpts().size());
        ordered.add(labelled);
        window.excerpts().stream().filter(e -> e != labelled).forEach(ordered::add);
        return ordered;
    }

    private static Citation citation(DocumentChunk chunk, int localStart, int localEnd, MatchMethod method) {
        return new Citation(chunk.getDocumentId(), chunk.pageAt(chunk.getSpanStart() + localStart),
                chunk.getClauseNumber(), chunk.getSpanStart() + localStart, chunk.getSpanStart() + localEnd,
                chunk.getText().substring(localStart, localEnd), chunk.getId(), method);
    }

    /**
     * Substring search ignoring case, runs of whitespace and typographic quote/dash variants.
     *
     * @return {@code [start, end)} in {@code text}, or {@code null}
     */
    static int[] normalizedFind(String text, String quote) {
        Normalized normalizedText = normalize(text);
        Normalized normalizedQuote = normalize(quote);
        String needle = normalizedQuote.value().strip();
        if (needle.isEmpty()) {
            return null;
        }
        int idx = normalizedText.value().indexOf(needle);
        if (idx < 0) {
            return null;
        }
        int start = normalizedText.offsets()[idx];
        int end = normalizedText.offsets()[idx + needle.length() - 1] + 1;
        return new int[]{start, end};
    }

    /**
     * Best window of the quote's length in {@code text} by token overlap.
     *
     * @return {@code [start, end)} in {@code text} when the overlap ratio reaches
     *         {@code threshold}, otherwise {@code null}
     */
    static int[] fuzzyFind(String text, String quote, double threshold) {
        List<String> quoteKeys = new ArrayList<>();
        for (Token token : tokens(quote)) {
            quoteKeys.add(token.key());
        }
        if (quoteKeys.size() < MIN_FUZZY_TOKENS) {
            return null;
        }
        List<Token> textTokens = tokens(text);
        if (textTokens.isEmpty()) {
            return null;
        }
        int width = Math.min(quoteKeys.size(), textTokens.size());
        double bestScore = 0.0;
        int bestStart = -1;
        for (int i = 0; i + width <= textTokens.size(); i++) {
            Map<String, Integer> remaining = new HashMap<>();
            quoteKeys.forEach(key -> remaining.merge(key, 1, Integer::sum));
            int matched = 0;
            for (int j = i; j < i + width; j++) {
                Integer count = remaining.get(textTokens.get(j).key());
                if (count != null && count > 0) {
                    remaining.put(textTokens.get(j).key(), count - 1);
                    matched++;
                }
            }
            double score = (double) matched / quoteKeys.size();
            if (score > bestScore) {
                bestScore = score;
                bestStart = i;
            }
        }
        if (bestStart < 0 || bestScore < threshold) {
            return null;
        }
        return new int[]{textTokens.get(bestStart).start(), textTokens.get(bestStart + width - 1).end()};
    }

    private static List<Token> tokens(String text) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String key = matcher.group().toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}$]", "");
            if (!key.isEmpty()) {
                tokens.add(new Token(key, matcher.start(), matcher.end()));
            }
        }
        return tokens;
    }

    private static Normalized normalize(String text) {
        StringBuilder value = new StringBuilder(text.length());
        int[] offsets = new int[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                if (value.length() > 0 && value.charAt(value.length() - 1) != ' ') {
                    offsets[value.length()] = i;
                    value.append(' ');
                }
                continue;
            }
            char mapped = switch (c) {
                case '\u2018', '\u2019' -> '\'';
                case '\u201C', '\u201D' -> '"';
                case '\u2013', '\u2014' -> '-';
                default -> Character.toLowerCase(c);
            };
            offsets[value.length()] = i;
            value.append(mapped);
        }
        return new Normalized(value.toString(), offsets);
    }

    private record Normalized(String value, int[] offsets) {
    }

    private record Token(String key, int start, int end) {
    }

    public record Resolution(String text, List<Citation> citations) {
        public Resolution {
            citations = List.copyOf(citations);
        }
    }
}
