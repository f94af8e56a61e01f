package com.jreinhal.covenant.rag.chunking;

import com.jreinhal.covenant.model.ContractMetadata;
import com.jreinhal.covenant.model.ContractMetadata.Party;
import com.jreinhal.covenant.model.ContractMetadata.PartyRole;
import com.jreinhal.covenant.model.ContractMetadata.Span;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads parties, effective date, governing law, mutuality, term and survival period off the
 * joined page text of a contract. Offsets in the result are offsets into that text.
 *
 * Patterns match common NDA drafting. A fact the patterns do not find is left {@code null};
 * nothing is guessed.
 */
@Component
public class ContractMetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(ContractMetadataExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    // Capitalized words on one line, optionally joined by "of" or "&"
    private static final String NAME = "(?-i:[A-Z][A-Za-z0-9&'-]*(?:[ \\t]+(?:of[ \\t]+|&[ \\t]+)?[A-Z][A-Za-z0-9&'-]*)*)";
    private static final String ROLE = "(disclos(?:ing|er)|receiving|recipient)";

    private static final Pattern LABELLED_PARTY = Pattern.compile("\\b" + ROLE + "\\s+party\\s*[:\\s]\\s*(" + NAME + ")", FLAGS);
    private static final Pattern DEFINED_PARTY = Pattern.compile(
            "(" + NAME + ")[ \\t,]*\\(\\s*(?:the\\s+|hereinafter\\s+)?[\"\u201c]?" + ROLE + "\\s+party[\"\u201d]?\\s*\\)", FLAGS);
    private static final Pattern BETWEEN_PARTIES = Pattern.compile(
            "\\bbetween\\s+(" + NAME + ")(?:[ \\t]*\\([^)]{0,80}\\)|,[^,;\\n]{1,60}(?=,))?,?\\s+and\\s+(" + NAME + ")", FLAGS);
    private static final Pattern COMPANY = Pattern.compile(
            "\\b([A-Z][A-Za-z0-9&'-]*(?:[ \\t]+[A-Z][A-Za-z0-9&'-]*){0,5}[ \\t]+"
                    + "(?:Inc|LLC|Corp|Corporation|Ltd|Limited|Company|Co|INC|CORP|CORPORATION|LTD|LIMITED|COMPANY))\\b");
    private static final Pattern ABBREVIATED_SUFFIX = Pattern.compile("(?i)(?:Inc|Corp|Ltd|Co)$");
    private static final Set<String> NAME_STOP_WORDS = Set.of("The", "THE", "This", "THIS", "That", "Between", "BETWEEN",
            "And", "By", "Each", "Any", "Such", "Whereas", "WHEREAS", "Agreement", "AGREEMENT", "Party", "Parties");

    private static final String MONTHS = "January|February|March|April|May|June|July|August|September|October|November|December";
    private static final String DATE = "(?:(?<m1>" + MONTHS + ")\\.?[ \\t]+(?<d1>\\d{1,2})(?:st|nd|rd|th)?,?[ \\t]+(?<y1>\\d{4})"
            + "|(?<d2>\\d{1,2})(?:st|nd|rd|th)?[ \\t]+(?:day[ \\t]+of[ \\t]+)?(?<m2>" + MONTHS + "),?[ \\t]+(?<y2>\\d{4})"
            + "|(?<![\\d/])(?<m3>\\d{1,2})[/-](?<d3>\\d{1,2})[/-](?<y3>\\d{4}|\\d{2})\\b)";
    private static final Pattern EFFECTIVE_DATE = Pattern.compile(
            "\\b(?:effective\\s+(?:as\\s+of|date(?:\\s+of)?|on)|dated(?:\\s+as\\s+of)?"
                    + "|(?:made|entered\\s+into)(?:\\s+and\\s+entered\\s+into)?\\s+(?:as\\s+of|on))"
                    + "[\\s:,\"\u201c\u201d(]*(?:the\\s+)?" + DATE, FLAGS);
    private static final Pattern ANY_DATE = Pattern.compile("\\b" + DATE, FLAGS);

    private static final Pattern GOVERNING_LAW = Pattern.compile(
            "\\b(?:governed\\s+by|construed\\s+(?:and\\s+enforced\\s+)?in\\s+accordance\\s+with|subject\\s+to)"
                    + "(?:[\\s,]+and\\s+construed\\s+in\\s+accordance\\s+with)?[\\s,]+the\\s+laws?\\s+of\\s+(?:the\\s+)?"
                    + "(?-i:([A-Z][^,.;]{0,60}))", FLAGS);
    private static final Pattern JURISDICTION = Pattern.compile("\\bjurisdiction\\s*:\\s*(?-i:([A-Z][^,.;\\n]{0,60}))", FLAGS);
    private static final Pattern LAW_TAIL = Pattern.compile(
            "\\s+(?:without|excluding|notwithstanding|applicable|as\\s+applied|in\\s+effect|which|that|and\\s+(?:the|any|all|each|its))\\b"
                    + "|\\n\\s*\\n", FLAGS);

    private static final String DURATION = "(\\d{1,3}|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve"
            + "|eighteen|twenty-four|thirty-six)\\s*(?:\\(\\d{1,3}\\)\\s*)?(months?|years?)\\b";
    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4), Map.entry("five", 5),
            Map.entry("six", 6), Map.entry("seven", 7), Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10),
            Map.entry("eleven", 11), Map.entry("twelve", 12), Map.entry("eighteen", 18), Map.entry("twenty-four", 24),
            Map.entry("thirty-six", 36));
    private static final List<Pattern> TERM = List.of(
            Pattern.compile("\\b(?:term|period)\\s+of\\s+" + DURATION, FLAGS),
            Pattern.compile("\\b(?:remain|continue)s?\\s+in\\s+(?:full\\s+)?(?:force|effect)(?:\\s+and\\s+effect)?\\s+for\\s+"
                    + "(?:a\\s+(?:term|period)\\s+of\\s+)?" + DURATION, FLAGS),
            Pattern.compile("\\bexpires?\\s+(?:on|after)\\s+" + DURATION, FLAGS));
    private static final List<Pattern> SURVIVAL = List.of(
            Pattern.compile("\\bsurvival\\s+period\\s+of\\s+" + DURATION, FLAGS),
            Pattern.compile("\\bsurviv\\w*\\b[^.]{0,80}?\\bfor\\s+(?:a\\s+(?:further\\s+|additional\\s+)?period\\s+of\\s+)?"
                    + DURATION, FLAGS));
    private static final Pattern SURVIVAL_WORD = Pattern.compile("\\bsurviv", FLAGS);

    private static final Pattern MUTUAL = Pattern.compile("\\b(?:mutual|reciprocal|bilateral|two-way)\\b", FLAGS);
    private static final Pattern UNILATERAL = Pattern.compile(
            "\\b(?:unilateral|one-way)\\b|\\bdisclosing\\s+party\\s+only\\b", FLAGS);
    private static final Pattern MUTUAL_HINT = Pattern.compile("\\b(?:both\\s+parties|each\\s+party)\\b", FLAGS);
    private static final Pattern UNILATERAL_HINT = Pattern.compile("\\bone\\s+party\\b", FLAGS);

    public ContractMetadata extract(String text) {
        if (text == null || text.isBlank()) {
            return ContractMetadata.empty();
        }
        List<Party> parties = findParties(text);
        Matcher date = findDate(text);
        Matcher law = find(GOVERNING_LAW, text);
        if (law == null) {
            law = find(JURISDICTION, text);
        }
        String governingLaw = null;
        Span governingLawSpan = null;
        if (law != null) {
            int lawEnd = lawEnd(text, law);
            governingLaw = text.substring(law.start(1), lawEnd).replaceAll("\\s+", " ");
            governingLawSpan = new Span(law.start(), lawEnd);
        }
        Matcher mutuality = earliest(text, MUTUAL, UNILATERAL);
        if (mutuality == null) {
            mutuality = earliest(text, MUTUAL_HINT, UNILATERAL_HINT);
        }
        Boolean mutual = mutuality != null
                ? MUTUAL.matcher(mutuality.group()).matches() || MUTUAL_HINT.matcher(mutuality.group()).matches()
                : null;
        Matcher term = findTerm(text);
        Matcher survival = earliest(text, SURVIVAL.toArray(new Pattern[0]));

        ContractMetadata metadata = new ContractMetadata(parties,
                date != null ? toDate(date) : null, span(date),
                governingLaw, governingLawSpan,
                mutual, span(mutuality),
                term != null ? months(term) : null, span(term),
                survival != null ? months(survival) : null, span(survival));
        log.debug("Metadata: {} parties, effectiveDate={}, governingLaw={}, mutual={}, termMonths={}, survivalMonths={}",
                parties.size(), metadata.effectiveDate(), governingLaw, mutual, metadata.termMonths(), metadata.survivalMonths());
        return metadata;
    }

    private static List<Party> findParties(String text) {
        List<Party> parties = new ArrayList<>();
        Matcher labelled = LABELLED_PARTY.matcher(text);
        while (labelled.find()) {
            if (!NAME_STOP_WORDS.contains(firstWord(labelled.group(2)))) {
                addParty(parties, text, labelled.start(2), labelled.end(2), roleOf(labelled.group(1)));
            }
        }
        Matcher defined = DEFINED_PARTY.matcher(text);
        while (defined.find()) {
            addParty(parties, text, defined.start(1), defined.end(1), roleOf(defined.group(2)));
        }
        Matcher between = BETWEEN_PARTIES.matcher(text);
        if (between.find()) {
            addParty(parties, text, between.start(1), between.end(1), PartyRole.UNSPECIFIED);
            addParty(parties, text, between.start(2), between.end(2), PartyRole.UNSPECIFIED);
        }
        // Company names anywhere are a weak signal; only used when the agreement names no parties itself
        if (parties.size() < 2) {
            Matcher company = COMPANY.matcher(text);
            while (company.find()) {
                addParty(parties, text, company.start(1), company.end(1), PartyRole.UNSPECIFIED);
            }
        }
        parties.sort(Comparator.comparingInt(Party::spanStart));
        return parties;
    }

    private static void addParty(List<Party> parties, String text, int start, int end, PartyRole role) {
        String candidate = text.substring(start, end);
        while (true) {
            int space = indexOfWhitespace(candidate);
            if (space < 0 || !NAME_STOP_WORDS.contains(candidate.substring(0, space))) {
                break;
            }
            int skip = space;
            while (skip < candidate.length() && Character.isWhitespace(candidate.charAt(skip))) {
                skip++;
            }
            start += skip;
            candidate = candidate.substring(skip);
        }
        if (NAME_STOP_WORDS.contains(candidate) || candidate.length() < 2) {
            return;
        }
        if (end < text.length() && text.charAt(end) == '.' && ABBREVIATED_SUFFIX.matcher(candidate).find()) {
            end++;
        }
        String name = text.substring(start, end).replaceAll("\\s+", " ");
        String key = name.toLowerCase(Locale.ROOT);
        for (int i = 0; i < parties.size(); i++) {
            Party existing = parties.get(i);
            String existingKey = existing.name().toLowerCase(Locale.ROOT);
            if (existingKey.contains(key) || key.contains(existingKey)) {
                if (existing.role() == PartyRole.UNSPECIFIED && role != PartyRole.UNSPECIFIED) {
                    parties.set(i, new Party(existing.name(), role, existing.spanStart(), existing.spanEnd()));
                }
                return;
            }
        }
        parties.add(new Party(name, role, start, end));
    }

    private static Matcher findDate(String text) {
        Matcher effective = EFFECTIVE_DATE.matcher(text);
        while (effective.find()) {
            if (toDate(effective) != null) {
                return effective;
            }
        }
        Matcher any = ANY_DATE.matcher(text);
        while (any.find()) {
            if (toDate(any) != null) {
                return any;
            }
        }
        return null;
    }

    static LocalDate toDate(Matcher m) {
        try {
            if (m.group("m1") != null) {
                return LocalDate.of(Integer.parseInt(m.group("y1")), month(m.group("m1")), Integer.parseInt(m.group("d1")));
            }
            if (m.group("m2") != null) {
                return LocalDate.of(Integer.parseInt(m.group("y2")), month(m.group("m2")), Integer.parseInt(m.group("d2")));
            }
            int year = Integer.parseInt(m.group("y3"));
            return LocalDate.of(year < 100 ? 2000 + year : year, Integer.parseInt(m.group("m3")), Integer.parseInt(m.group("d3")));
        } catch (DateTimeException e) {
            log.debug("Skipping impossible date '{}': {}", m.group(), e.getMessage());
            return null;
        }
    }

    private static Month month(String name) {
        return Month.valueOf(name.toUpperCase(Locale.ROOT));
    }

    private static Matcher findTerm(String text) {
        Matcher best = null;
        for (Pattern pattern : TERM) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                // "survive for a period of five years" is the survival period, not the term
                int sentenceStart = text.lastIndexOf('.', m.start() - 1) + 1;
                if (SURVIVAL_WORD.matcher(text.substring(sentenceStart, m.start())).find()) {
                    continue;
                }
                if (best == null || m.start() < best.start()) {
                    best = m;
                }
                break;
            }
        }
        return best;
    }

    private static int months(Matcher m) {
        String amount = m.group(1).toLowerCase(Locale.ROOT);
        int value = NUMBER_WORDS.containsKey(amount) ? NUMBER_WORDS.get(amount) : Integer.parseInt(amount);
        return m.group(2).toLowerCase(Locale.ROOT).startsWith("year") ? value * 12 : value;
    }

    /**
     * End of the jurisdiction name, cut before trailing qualifiers such as "without regard to".
     */
    private static int lawEnd(String text, Matcher law) {
        Matcher tail = LAW_TAIL.matcher(law.group(1));
        int end = tail.find() ? law.start(1) + tail.start() : law.end(1);
        while (end > law.start(1) && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private static Matcher find(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m : null;
    }

    private static Matcher earliest(String text, Pattern... patterns) {
        Matcher best = null;
        for (Pattern pattern : patterns) {
            Matcher m = find(pattern, text);
            if (m != null && (best == null || m.start() < best.start())) {
                best = m;
            }
        }
        return best;
    }

    private static Span span(Matcher m) {
        return m != null ? new Span(m.start(), m.end()) : null;
    }

    private static PartyRole roleOf(String label) {
        return label.toLowerCase(Locale.ROOT).startsWith("disclos") ? PartyRole.DISCLOSING : PartyRole.RECEIVING;
    }

    private static String firstWord(String name) {
        int space = indexOfWhitespace(name);
        return space < 0 ? name : name.substring(0, space);
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
