package com.jreinhal.covenant.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * An uploaded contract or NDA and its extraction state.
 *
 * Status changes go through {@code DocumentStore} conditional updates, never through a
 * read-modify-save of this object, so concurrent writers cannot overwrite each other.
 */
@Document(collection = "documents")
public class ContractDocument {

    @Id
    private String id;

    private String filename;
    // As handed over by the uploader; resolved into documentType during extraction
    private String declaredType;
    private DocumentType documentType;

    // Key into the content store
    private String contentRef;
    private long sizeBytes;

    @Indexed
    private String contentHash;

    @Indexed
    private DocumentStatus status;

    private int pageCount;
    private int textLength;
    private int ocrPageCount;
    private int chunkCount;

    private String failureReason;
    private Integer failedChunkIndex;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant indexedAt;

    // Read from the text during chunking; null until a pass gets that far
    private ContractMetadata metadata;

    public ContractDocument() {
    }

    public ContractDocument(String id, String filename, String declaredType, String contentRef,
                            long sizeBytes, String contentHash, Instant createdAt) {
        this.id = id;
        this.filename = filename;
        this.declaredType = declaredType;
        this.contentRef = contentRef;
        this.sizeBytes = sizeBytes;
        this.contentHash = contentHash;
        this.status = DocumentStatus.PENDING;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getDeclaredType() {
        return declaredType;
    }

    public void setDeclaredType(String declaredType) {
        this.declaredType = declaredType;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    public void setDocumentType(DocumentType documentType) {
        this.documentType = documentType;
    }

    public String getContentRef() {
        return contentRef;
    }

    public void setContentRef(String contentRef) {
        this.contentRef = contentRef;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public DocumentStatus getStatus() {
        return status;
    }

    public void setStatus(DocumentStatus status) {
        this.status = status;
    }

    public int getPageCount() {
        return pageCount;
    }

    public void setPageCount(int pageCount) {
        this.pageCount = pageCount;
    }

    public int getTextLength() {
        return textLength;
    }

    public void setTextLength(int textLength) {
        this.textLength = textLength;
    }

    public int getOcrPageCount() {
        return ocrPageCount;
    }

    public void setOcrPageCount(int ocrPageCount) {
        this.ocrPageCount = ocrPageCount;
    }

    public int getChunkCount() {
        return chunkCount;
    }

    public void setChunkCount(int chunkCount) {
        this.chunkCount = chunkCount;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public Integer getFailedChunkIndex() {
        return failedChunkIndex;
    }

    public void setFailedChunkIndex(Integer failedChunkIndex) {
        this.failedChunkIndex = failedChunkIndex;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getIndexedAt() {
        return indexedAt;
    }

    public void setIndexedAt(Instant indexedAt) {
        this.indexedAt = indexedAt;
    }

    public ContractMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(ContractMetadata metadata) {
        this.metadata = metadata;
    }
}
