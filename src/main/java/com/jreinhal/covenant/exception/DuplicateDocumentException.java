package com.jreinhal.covenant.exception;

/**
 * Raised when uploaded bytes hash to a document already stored under another id.
 */
public class DuplicateDocumentException extends RuntimeException {
    private final String existingDocumentId;

    public DuplicateDocumentException(String existingDocumentId) {
        super("A document with identical contents already exists: " + existingDocumentId);
        this.existingDocumentId = existingDocumentId;
    }

    public String getExistingDocumentId() {
        return this.existingDocumentId;
    }
}
