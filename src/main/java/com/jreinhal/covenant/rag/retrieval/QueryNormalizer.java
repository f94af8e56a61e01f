package com.jreinhal.covenant.rag.retrieval;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Fixes common misspellings of contract vocabulary and expands contract phrases with the
 * wording agreements actually use ("governing state" also searches "governing law" and
 * "jurisdiction"). The expansion feeds keyword search only.
 */
@Component
public class QueryNormalizer {

    // Multi-word fixes run before single words
    private static final List<Map.Entry<String, String>> PHRASE_CORRECTIONS = List.of(
            Map.entry("effective data", "effective date"),
            Map.entry("expiration data", "expiration date"),
            Map.entry("expiry data", "expiry date"),
            Map.entry("signed data", "signed date"),
            Map.entry("governing sate", "governing state"),
            Map.entry("non disclosure", "non-disclosure"));

    private static final List<Correction> WORD_CORRECTIONS = List.of(
            word("effecitve", "effective"),
            word("efective", "effective"),
            word("effctive", "effective"),
            word("expiraton", "expiration"),
            word("experation", "expiration"),
            word("expirey", "expiry"),
            word("jurisdicition", "jurisdiction"),
            word("jurisdication", "jurisdiction"),
            word("jurisdicton", "jurisdiction"),
            word("agreemnt", "agreement"),
            word("agrement", "agreement"),
            word("aggreement", "agreement"),
            word("confidencial", "confidential"),
            word("confidental", "confidential"),
            word("confidentail", "confidential"),
            word("teh", "the"),
            word("goverining", "governing"),
            word("govening", "governing"),
            word("paries", "parties"),
            word("partys", "parties"),
            word("terminaton", "termination"),
            word("survivial", "survival"),
            word("jan", "january"),
            word("feb", "february"),
            word("mar", "march"),
            word("apr", "april"),
            word("jun", "june"),
            word("jul", "july"),
            word("aug", "august"),
            word("sep", "september"),
            word("sept", "september"),
            word("oct", "october"),
            word("nov", "november"),
            word("dec", "december"));

    // "data" only means "date" next to date vocabulary
    private static final Pattern DATE_CONTEXT = Pattern.compile("\\b(?:effective|expiration|expiry|signed|date)\\b");
    private static final Pattern DATA = Pattern.compile("\\bdata\\b");

    private static final List<Map.Entry<Pattern, List<String>>> SYNONYMS = List.of(
            Map.entry(phrase("governing state"), List.of("governing law", "jurisdiction", "law applies")),
            Map.entry(phrase("governing law"), List.of("governing state", "jurisdiction")),
            Map.entry(phrase("jurisdiction"), List.of("governing law", "governing state")),
            Map.entry(phrase("effective date"), List.of("date of agreement", "signed date", "commencement")),
            Map.entry(phrase("expiration"), List.of("expiry", "expires", "termination")),
            Map.entry(phrase("term"), List.of("duration", "length", "period")),
            Map.entry(phrase("duration"), List.of("term", "length", "period")),
            Map.entry(phrase("parties"), List.of("party", "between")),
            Map.entry(phrase("confidential information"),
                    List.of("proprietary information", "trade secrets")),
            Map.entry(phrase("survival"), List.of("survive", "surviving")),
            Map.entry(phrase("mutual"), List.of("reciprocal", "bilateral")),
            Map.entry(phrase("unilateral"), List.of("one-way")));

    /**
     * Lower-cases the query and applies spelling fixes.
     */
    public String normalize(String query) {
        String normalized = query.toLowerCase(Locale.ROOT).strip().replaceAll("\\s+", " ");
        for (Map.Entry<String, String> fix : PHRASE_CORRECTIONS) {
            normalized = normalized.replace(fix.getKey(), fix.getValue());
        }
        for (Correction fix : WORD_CORRECTIONS) {
            normalized = fix.pattern().matcher(normalized).replaceAll(Matcher.quoteReplacement(fix.replacement()));
        }
        if (DATE_CONTEXT.matcher(normalized).find()) {
            normalized = DATA.matcher(normalized).replaceAll("date");
        }
        return normalized;
    }

    /**
     * The normalized query followed by synonyms of the contract phrases it contains. A query
     * with no known phrase is returned normalized and otherwise unchanged.
     */
    public String expandForKeywordSearch(String query) {
        String normalized = this.normalize(query);
        Set<String> additions = new LinkedHashSet<>();
        for (Map.Entry<Pattern, List<String>> entry : SYNONYMS) {
            if (entry.getKey().matcher(normalized).find()) {
                for (String synonym : entry.getValue()) {
                    if (!phrase(synonym).matcher(normalized).find()) {
                        additions.add(synonym);
                    }
                }
            }
        }
        return additions.isEmpty() ? normalized : normalized + " " + String.join(" ", additions);
    }

    private static Correction word(String misspelling, String replacement) {
        return new Correction(phrase(misspelling), replacement);
    }

    private static Pattern phrase(String words) {
        return Pattern.compile("\\b" + Pattern.quote(words) + "\\b");
    }

    private record Correction(Pattern pattern, String replacement) {
    }
}
