package com.jreinhal.covenant.rag.chunking;

import com.jreinhal.covenant.config.ChunkingProperties;
import com.jreinhal.covenant.model.DocumentChunk;
import com.jreinhal.covenant.model.PageText;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits page text into overlapping fixed-size windows.
 *
 * <h2>Text model</h2>
 * Pages are joined with {@link #PAGE_SEPARATOR}; chunk spans are absolute offsets into that
 * joined text, and every chunk's text is exactly {@code joined.substring(spanStart, spanEnd)}.
 * A chunk's page is the page its first character belongs to; the start offset of every later
 * page inside the span is kept on the chunk so a quote can be pinned to its own page.
 *
 * <h2>Windows</h2>
 * Each window covers at most {@code chunkSize} characters. When the window does not reach the
 * end of the text it is shortened to the last paragraph break, sentence end or whitespace found
 * in its second half. The next window starts {@code chunkOverlap} characters before the previous
 * end, moved forward to a word start, and always strictly after the previous start. Leading and
 * trailing whitespace is trimmed from each window and all-whitespace windows are skipped.
 * Text shorter than one window yields exactly one chunk.
 */
@Component
public class SlidingWindowChunker {
    private static final Logger log = LoggerFactory.getLogger(SlidingWindowChunker.class);
    public static final String PAGE_SEPARATOR = "\n\n";

    private final ChunkingProperties properties;
    private final ClauseTagger clauseTagger;

    public SlidingWindowChunker(ChunkingProperties properties, ClauseTagger clauseTagger) {
        properties.validate();
        this.properties = properties;
        this.clauseTagger = clauseTagger;
    }

    public static String joinPages(List<PageText> pages) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < pages.size(); i++) {
            if (i > 0) {
                joined.append(PAGE_SEPARATOR);
            }
            joined.append(pages.get(i).text());
        }
        return joined.toString();
    }

    public List<DocumentChunk> chunk(String documentId, List<PageText> pages) {
        if (pages.isEmpty()) {
            return List.of();
        }
        String text = joinPages(pages);
        int[] pageStarts = new int[pages.size()];
        int offset = 0;
        for (int i = 0; i < pages.size(); i++) {
            pageStarts[i] = offset;
            offset += pages.get(i).text().length() + PAGE_SEPARATOR.length();
        }

        int size = this.properties.getChunkSize();
        int overlap = this.properties.getChunkOverlap();
        int length = text.length();
        List<DocumentChunk> chunks = new ArrayList<>();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + size, length);
            if (end < length) {
                end = findBreak(text, start, end, size);
            }
            int spanStart = start;
            while (spanStart < end && Character.isWhitespace(text.charAt(spanStart))) {
                spanStart++;
            }
            int spanEnd = end;
            while (spanEnd > spanStart && Character.isWhitespace(text.charAt(spanEnd - 1))) {
                spanEnd--;
            }
            if (spanStart < spanEnd) {
                chunks.add(this.buildChunk(documentId, chunks.size(), text, spanStart, spanEnd, pages, pageStarts));
            }
            if (end >= length) {
                break;
            }
            int next = Math.max(end - overlap, start + 1);
            start = alignToWordStart(text, next, end);
        }
        log.debug("Chunked {} chars into {} chunks (size={}, overlap={})", length, chunks.size(), size, overlap);
        return chunks;
    }

    private DocumentChunk buildChunk(String documentId, int index, String text, int spanStart, int spanEnd,
                                     List<PageText> pages, int[] pageStarts) {
        int pageNum = pages.get(pageIndexOf(pageStarts, spanStart)).pageNum();
        int pageEnd = pages.get(pageIndexOf(pageStarts, spanEnd - 1)).pageNum();
        String chunkText = text.substring(spanStart, spanEnd);
        DocumentChunk chunk = new DocumentChunk(documentId, index, pageNum, pageEnd, spanStart, spanEnd, chunkText);
        List<DocumentChunk.PageBreak> breaks = new ArrayList<>();
        for (int i = 0; i < pageStarts.length; i++) {
            if (pageStarts[i] > spanStart && pageStarts[i] < spanEnd) {
                breaks.add(new DocumentChunk.PageBreak(pageStarts[i], pages.get(i).pageNum()));
            }
        }
        chunk.setPageBreaks(breaks);

        boolean lineStart = spanStart == 0 || text.charAt(spanStart - 1) == '\n';
        ClauseTagger.ClauseTag tag = this.clauseTagger.tag(chunkText, index == 0, lineStart);
        chunk.setClauseNumber(tag.clauseNumber());
        chunk.setClauseTitle(tag.clauseTitle());
        chunk.setSectionType(tag.sectionType());
        chunk.setSecondaryClauseNumbers(new ArrayList<>(tag.secondaryClauseNumbers()));
        if (tag.hasMultipleClauseStarts()) {
            log.warn("Chunk {} of document {} contains {} clause starts; tagged with the first ({}), also saw {}",
                    index, documentId, tag.secondaryClauseNumbers().size() + 1,
                    tag.clauseNumber() != null ? tag.clauseNumber() : tag.clauseTitle(), tag.secondaryClauseNumbers());
        }
        return chunk;
    }

    static int findBreak(String text, int start, int end, int size) {
        int floor = start + Math.max(1, size / 2);
        int paragraph = text.lastIndexOf("\n\n", end - 2);
        if (paragraph >= floor) {
            return paragraph + 2;
        }
        for (int i = end - 1; i >= floor; i--) {
            char c = text.charAt(i - 1);
            if ((c == '.' || c == ';' || c == '?' || c == '!') && Character.isWhitespace(text.charAt(i))) {
                return i + 1;
            }
        }
        for (int i = end - 1; i >= floor; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i + 1;
            }
        }
        return end;
    }

    private static int alignToWordStart(String text, int position, int limit) {
        if (position == 0 || Character.isWhitespace(text.charAt(position - 1)) || Character.isWhitespace(text.charAt(position))) {
            return position;
        }
        int cursor = position;
        while (cursor < limit && !Character.isWhitespace(text.charAt(cursor))) {
            cursor++;
        }
        return cursor < limit ? cursor : position;
    }

    private static int pageIndexOf(int[] pageStarts, int offset) {
        int found = Arrays.binarySearch(pageStarts, offset);
        if (found >= 0) {
            return found;
        }
        return Math.max(0, -found - 2);
    }
}
