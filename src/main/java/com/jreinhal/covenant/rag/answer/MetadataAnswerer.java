package com.jreinhal.covenant.rag.answer;

import com.jreinhal.covenant.model.AnswerResult;
import com.jreinhal.covenant.model.Citation;
import com.jreinhal.covenant.model.Citation.MatchMethod;
import com.jreinhal.covenant.model.ContractDocument;
import com.jreinhal.covenant.model.ContractMetadata;
import com.jreinhal.covenant.model.ContractMetadata.Party;
import com.jreinhal.covenant.model.ContractMetadata.PartyRole;
import com.jreinhal.covenant.model.ContractMetadata.Span;
import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.model.DocumentStatus;
import com.jreinhal.covenant.rag.retrieval.QueryNormalizer;
import com.jreinhal.covenant.repository.ChunkStore;
import com.jreinhal.covenant.repository.DocumentStore;
import com.jreinhal.covenant.util.LogSanitizer;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Answers questions about a single contract's parties, dates, governing law, mutuality, term
 * and survival period from the metadata read at ingestion, without a model call.
 *
 * <p>Each answer cites the chunk text the fact was read from. A question that is not about one
 * of these facts, or a fact the contract does not state, or a fact whose source text no longer
 * maps to a stored chunk, gives an empty result and the caller falls back to retrieval.</p>
 */
@Component
public class MetadataAnswerer {
    private static final Logger log = LoggerFactory.getLogger(MetadataAnswerer.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);
    private static final Pattern TERM_WORD = Pattern.compile("\\b(?:term|duration|how long|length)\\b");

    enum Topic {
        PARTIES,
        MUTUALITY,
        EXPIRATION,
        EFFECTIVE_DATE,
        GOVERNING_LAW,
        SURVIVAL,
        TERM
    }

    private final DocumentStore documentStore;
    private final ChunkStore chunkStore;
    private final QueryNormalizer queryNormalizer;

    public MetadataAnswerer(DocumentStore documentStore, ChunkStore chunkStore, QueryNormalizer queryNormalizer) {
        this.documentStore = documentStore;
        this.chunkStore = chunkStore;
        this.queryNormalizer = queryNormalizer;
    }

    public Optional<AnswerResult> answer(String question, String documentId) {
        if (documentId == null || documentId.isBlank()) {
            return Optional.empty();
        }
        Optional<Topic> topic = classify(this.queryNormalizer.normalize(question));
        if (topic.isEmpty()) {
            return Optional.empty();
        }
        ContractDocument document = this.documentStore.findById(documentId).orElse(null);
        if (document == null || document.getStatus() != DocumentStatus.INDEXED || document.getMetadata() == null) {
            return Optional.empty();
        }
        ContractMetadata metadata = document.getMetadata();
        Optional<Fact> fact = factFor(topic.get(), metadata);
        if (fact.isEmpty()) {
            log.debug("Document {} states no {}; using retrieval", documentId, topic.get());
            return Optional.empty();
        }
        List<DocumentChunk> chunks = this.chunkStore.findByDocumentId(documentId);
        List<Citation> citations = new ArrayList<>();
        for (Span span : fact.get().spans()) {
            Optional<Citation> citation = cite(chunks, span);
            if (citation.isEmpty()) {
                log.warn("Metadata span [{}, {}) of document {} is outside its stored chunks; using retrieval",
                        span.start(), span.end(), documentId);
                return Optional.empty();
            }
            citations.add(citation.get());
        }
        log.info("Answered {} question {} from document metadata", topic.get(), LogSanitizer.querySummary(question));
        return Optional.of(new AnswerResult(fact.get().text(), citations, true, 0));
    }

    /**
     * Question kinds are checked in a fixed order; clause questions ("what does the ... clause
     * say") are never metadata questions.
     */
    static Optional<Topic> classify(String q) {
        if (containsAny(q, "who are the parties", "parties to", "party to the", "which parties", "what parties",
                "who signed", "parties involved")) {
            return Optional.of(Topic.PARTIES);
        }
        if (containsAny(q, "what does the", "clause specify", "clause state", "clause say", "section say")) {
            return Optional.empty();
        }
        if (containsAny(q, "mutual", "unilateral", "one-way")
                && containsAny(q, "is the", "is this", "is it", "type of", "mutual or", "unilateral or", "whether")) {
            return Optional.of(Topic.MUTUALITY);
        }
        if (containsAny(q, "expire", "expiration", "expiry", "end date")) {
            return Optional.of(Topic.EXPIRATION);
        }
        if (containsAny(q, "effective date", "date of agreement", "date of the agreement", "signed date", "start date",
                "when was", "when did")) {
            return Optional.of(Topic.EFFECTIVE_DATE);
        }
        if (containsAny(q, "governing law", "governing state", "jurisdiction", "law applies", "what law", "which law",
                "laws of which", "law governs")) {
            return Optional.of(Topic.GOVERNING_LAW);
        }
        if (containsAny(q, "survival", "survive")) {
            return Optional.of(Topic.SURVIVAL);
        }
        if (TERM_WORD.matcher(q).find() && !containsAny(q, "after", "clause", "mutual")) {
            return Optional.of(Topic.TERM);
        }
        return Optional.empty();
    }

    static Optional<Fact> factFor(Topic topic, ContractMetadata m) {
        switch (topic) {
            case PARTIES:
                if (m.parties().isEmpty()) {
                    return Optional.empty();
                }
                List<String> names = new ArrayList<>();
                List<Span> spans = new ArrayList<>();
                for (Party party : m.parties()) {
                    names.add(party.role() == PartyRole.UNSPECIFIED ? party.name()
                            : party.name() + " (" + party.role().name().toLowerCase(Locale.ROOT) + " party)");
                    spans.add(new Span(party.spanStart(), party.spanEnd()));
                }
                return Optional.of(new Fact("The parties are " + joinNames(names) + ".", spans));
            case MUTUALITY:
                if (m.mutual() == null) {
                    return Optional.empty();
                }
                return Optional.of(new Fact(m.mutual() ? "The agreement is mutual." : "The agreement is unilateral.",
                        List.of(m.mutualSpan())));
            case EXPIRATION:
                if (m.effectiveDate() == null || m.termMonths() == null) {
                    return Optional.empty();
                }
                LocalDate expires = m.effectiveDate().plusMonths(m.termMonths());
                return Optional.of(new Fact("The agreement expires on " + DATE_FORMAT.format(expires) + ", "
                        + formatDuration(m.termMonths()) + " after its effective date of "
                        + DATE_FORMAT.format(m.effectiveDate()) + ".", List.of(m.effectiveDateSpan(), m.termSpan())));
            case EFFECTIVE_DATE:
                if (m.effectiveDate() == null) {
                    return Optional.empty();
                }
                return Optional.of(new Fact("The effective date is " + DATE_FORMAT.format(m.effectiveDate()) + ".",
                        List.of(m.effectiveDateSpan())));
            case GOVERNING_LAW:
                if (m.governingLaw() == null) {
                    return Optional.empty();
                }
                return Optional.of(new Fact("The agreement is governed by the laws of " + lawName(m.governingLaw()) + ".",
                        List.of(m.governingLawSpan())));
            case SURVIVAL:
                if (m.survivalMonths() == null) {
                    return Optional.empty();
                }
                return Optional.of(new Fact("Obligations survive for " + formatDuration(m.survivalMonths()) + ".",
                        List.of(m.survivalSpan())));
            case TERM:
                if (m.termMonths() == null) {
                    return Optional.empty();
                }
                return Optional.of(new Fact("The term is " + formatDuration(m.termMonths()) + ".", List.of(m.termSpan())));
            default:
                return Optional.empty();
        }
    }

    /**
     * Cites the chunk that holds the whole span, or failing that the chunk where it starts,
     * clipped to that chunk.
     */
    static Optional<Citation> cite(List<DocumentChunk> chunks, Span span) {
        DocumentChunk holder = null;
        for (DocumentChunk chunk : chunks) {
            if (chunk.getSpanStart() <= span.start() && span.end() <= chunk.getSpanEnd()) {
                holder = chunk;
                break;
            }
            if (holder == null && chunk.getSpanStart() <= span.start() && span.start() < chunk.getSpanEnd()) {
                holder = chunk;
            }
        }
        if (holder == null) {
            return Optional.empty();
        }
        int start = span.start();
        int end = Math.min(span.end(), holder.getSpanEnd());
        String excerpt = holder.getText().substring(start - holder.getSpanStart(), end - holder.getSpanStart());
        return Optional.of(new Citation(holder.getDocumentId(), holder.pageAt(start), holder.getClauseNumber(),
                start, end, excerpt, holder.getId(), MatchMethod.METADATA));
    }

    static String formatDuration(int months) {
        int years = months / 12;
        int rest = months % 12;
        if (years == 0) {
            return rest + (rest == 1 ? " month" : " months");
        }
        String text = years + (years == 1 ? " year" : " years");
        return rest == 0 ? text : text + " and " + rest + (rest == 1 ? " month" : " months");
    }

    private static String lawName(String governingLaw) {
        return governingLaw.matches("(?i)(?:state|commonwealth|province|republic|kingdom)\\b.*") ? "the " + governingLaw
                : governingLaw;
    }

    private static String joinNames(List<String> names) {
        if (names.size() == 1) {
            return names.get(0);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + " and " + names.get(names.size() - 1);
    }

    private static boolean containsAny(String text, String... phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    record Fact(String text, List<Span> spans) {
    }
}
