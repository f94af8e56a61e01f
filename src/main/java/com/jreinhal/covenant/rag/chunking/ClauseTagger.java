package com.jreinhal.covenant.rag.chunking;

import com.jreinhal.covenant.model.SectionType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Detects contract structure inside a chunk: numbered clauses ({@code 1.}, {@code 2)}, {@code 4.2},
 * {@code 4.2.1}), ALL-CAPS headers ending in a colon, recitals and the agreement title line.
 *
 * A chunk carries at most one tag, taken from its first marker. Further clause starts are
 * returned as secondary numbers so the caller can report them.
 */
@Component
public class ClauseTagger {

    private static final Pattern NUMBERED = Pattern.compile(
            "(?m)^[ \\t]*(?:(?:Section|SECTION|Article|ARTICLE)[ \\t]+)?(\\d{1,3}(?:\\.\\d{1,3}){0,2})[.)]?[ \\t]+(?=[A-Z(\"])([^\\n]*)$");
    private static final Pattern HEADER = Pattern.compile("(?m)^[ \\t]*([A-Z][A-Z \\t&/-]{2,60}):");
    private static final Pattern RECITAL = Pattern.compile("(?m)^[ \\t]*(WHEREAS|RECITALS?|BACKGROUND)\\b");
    private static final Pattern TITLE_KEYWORDS = Pattern.compile(
            "\\b(AGREEMENT|NDA|NON-DISCLOSURE|DISCLOSURE|CONFIDENTIALITY)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLAUSE_TITLE = Pattern.compile("^([A-Z][A-Za-z \\t&/,'-]{1,80}?)[ \\t]*[.:](?:[ \\t]+|$)");
    private static final int MAX_BARE_TITLE_LENGTH = 80;
    private static final int MAX_TITLE_WORDS = 8;
    private static final int MAX_TITLE_LINE_LENGTH = 120;

    /**
     * @param firstChunk whether the chunk opens the document; only then can it carry the title
     * @param startsAtLineStart whether the character before the chunk is a line break (or none),
     *                          so a marker at offset 0 really begins a line
     */
    public ClauseTag tag(String text, boolean firstChunk, boolean startsAtLineStart) {
        List<Marker> markers = new ArrayList<>();
        if (firstChunk) {
            this.findTitle(text).ifPresent(markers::add);
        }
        Matcher numbered = NUMBERED.matcher(text);
        while (numbered.find()) {
            if (numbered.start() == 0 && !startsAtLineStart) {
                continue;
            }
            markers.add(new Marker(numbered.start(), numbered.group(1), titleOf(numbered.group(2)), SectionType.CLAUSE));
        }
        Matcher recital = RECITAL.matcher(text);
        if (recital.find()) {
            markers.add(new Marker(recital.start(), null, "Recitals", SectionType.RECITAL));
        }
        Matcher header = HEADER.matcher(text);
        while (header.find()) {
            if (header.start() == 0 && !startsAtLineStart) {
                continue;
            }
            int offset = header.start();
            if (markers.stream().noneMatch(m -> m.offset() == offset)) {
                markers.add(new Marker(offset, null, header.group(1).trim(), SectionType.HEADER));
            }
        }
        if (markers.isEmpty()) {
            return ClauseTag.NONE;
        }
        markers.sort(Comparator.comparingInt(Marker::offset));
        Marker primary = markers.get(0);
        List<String> secondary = new ArrayList<>();
        for (Marker marker : markers.subList(1, markers.size())) {
            if (marker.sectionType() == SectionType.CLAUSE || marker.sectionType() == SectionType.HEADER) {
                secondary.add(marker.number() != null ? marker.number() : marker.title());
            }
        }
        return new ClauseTag(primary.number(), primary.title(), primary.sectionType(), secondary);
    }

    private Optional<Marker> findTitle(String text) {
        int offset = 0;
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                if (trimmed.length() <= MAX_TITLE_LINE_LENGTH && TITLE_KEYWORDS.matcher(trimmed).find()
                        && (isMostlyUpperCase(trimmed) || !trimmed.endsWith("."))) {
                    return Optional.of(new Marker(offset + line.indexOf(trimmed), null, trimmed, SectionType.TITLE));
                }
                return Optional.empty();
            }
            offset += line.length() + 1;
        }
        return Optional.empty();
    }

    static String titleOf(String rest) {
        String line = rest == null ? "" : rest.trim();
        if (line.isEmpty()) {
            return null;
        }
        Matcher matcher = CLAUSE_TITLE.matcher(line);
        if (matcher.find() && wordCount(matcher.group(1)) <= MAX_TITLE_WORDS) {
            return matcher.group(1).trim();
        }
        if (line.length() <= MAX_BARE_TITLE_LENGTH && wordCount(line) <= MAX_TITLE_WORDS
                && !line.endsWith(".") && !line.endsWith(",")) {
            return line;
        }
        return null;
    }

    private static int wordCount(String value) {
        return value.trim().split("\\s+").length;
    }

    private static boolean isMostlyUpperCase(String line) {
        long letters = line.chars().filter(Character::isLetter).count();
        long upper = line.chars().filter(Character::isUpperCase).count();
        return letters > 0 && upper * 10 >= letters * 8;
    }

    private record Marker(int offset, String number, String title, SectionType sectionType) {
    }

    public record ClauseTag(String clauseNumber, String clauseTitle, SectionType sectionType, List<String> secondaryClauseNumbers) {
        static final ClauseTag NONE = new ClauseTag(null, null, SectionType.BODY, List.of());

        public ClauseTag {
            secondaryClauseNumbers = List.copyOf(secondaryClauseNumbers);
        }

        public boolean hasMultipleClauseStarts() {
            return !this.secondaryClauseNumbers.isEmpty();
        }
    }
}
