package com.jreinhal.covenant.model;

import java.util.ArrayList;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A page-anchored window of document text, the unit both indexes store and retrieval returns.
 *
 * Spans are absolute character offsets {@code [spanStart, spanEnd)} into the document text
 * formed by joining page texts with a blank line, so {@code text} always equals that substring.
 * Identity is {@code documentId:chunkIndex}, which keeps reprocessing an upsert of the same keys.
 * A chunk that crosses pages records where each later page begins in {@code pageBreaks}.
 */
@Document(collection = "document_chunks")
@CompoundIndex(name = "document_ordinal_idx", def = "{'documentId': 1, 'chunkIndex': 1}", unique = true)
public class DocumentChunk {

    @Id
    private String id;

    @Indexed
    private String documentId;
    private int chunkIndex;

    private int pageNum;
    private int pageEnd;
    private int spanStart;
    private int spanEnd;
    private String text;

    private String clauseNumber;
    private String clauseTitle;
    private SectionType sectionType;
    private List<String> secondaryClauseNumbers = new ArrayList<>();
    private List<PageBreak> pageBreaks = new ArrayList<>();

    public DocumentChunk() {
    }

    public DocumentChunk(String documentId, int chunkIndex, int pageNum, int pageEnd,
                         int spanStart, int spanEnd, String text) {
        this.id = chunkId(documentId, chunkIndex);
        this.documentId = documentId;
        this.chunkIndex = chunkIndex;
        this.pageNum = pageNum;
        this.pageEnd = pageEnd;
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.text = text;
        this.sectionType = SectionType.BODY;
    }

    public static String chunkId(String documentId, int chunkIndex) {
        return documentId + ":" + chunkIndex;
    }

    /**
     * Page holding the character at an absolute offset inside this chunk.
     */
    public int pageAt(int absoluteOffset) {
        int page = this.pageNum;
        for (PageBreak pageBreak : this.pageBreaks) {
            if (pageBreak.offset() > absoluteOffset) {
                break;
            }
            page = pageBreak.pageNum();
        }
        return page;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDocumentId() {
        return documentId;
    }

    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public void setChunkIndex(int chunkIndex) {
        this.chunkIndex = chunkIndex;
    }

    public int getPageNum() {
        return pageNum;
    }

    public void setPageNum(int pageNum) {
        this.pageNum = pageNum;
    }

    public int getPageEnd() {
        return pageEnd;
    }

    public void setPageEnd(int pageEnd) {
        this.pageEnd = pageEnd;
    }

    public int getSpanStart() {
        return spanStart;
    }

    public void setSpanStart(int spanStart) {
        this.spanStart = spanStart;
    }

    public int getSpanEnd() {
        return spanEnd;
    }

    public void setSpanEnd(int spanEnd) {
        this.spanEnd = spanEnd;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getClauseNumber() {
        return clauseNumber;
    }

    public void setClauseNumber(String clauseNumber) {
        this.clauseNumber = clauseNumber;
    }

    public String getClauseTitle() {
        return clauseTitle;
    }

    public void setClauseTitle(String clauseTitle) {
        this.clauseTitle = clauseTitle;
    }

    public SectionType getSectionType() {
        return sectionType;
    }

    public void setSectionType(SectionType sectionType) {
        this.sectionType = sectionType;
    }

    public List<String> getSecondaryClauseNumbers() {
        return secondaryClauseNumbers;
    }

    public void setSecondaryClauseNumbers(List<String> secondaryClauseNumbers) {
        this.secondaryClauseNumbers = secondaryClauseNumbers == null ? new ArrayList<>() : secondaryClauseNumbers;
    }

    public List<PageBreak> getPageBreaks() {
        return pageBreaks;
    }

    public void setPageBreaks(List<PageBreak> pageBreaks) {
        this.pageBreaks = pageBreaks == null ? new ArrayList<>() : pageBreaks;
    }

    /**
     * Absolute offset where page {@code pageNum} starts within a chunk's span.
     */
    public record PageBreak(int offset, int pageNum) {
    }
}
