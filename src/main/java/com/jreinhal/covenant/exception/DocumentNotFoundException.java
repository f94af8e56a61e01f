package com.jreinhal.covenant.exception;

import com.jreinhal.covenant.util.LogSanitizer;

public class DocumentNotFoundException extends RuntimeException {
    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + LogSanitizer.documentId(documentId));
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return this.documentId;
    }
}
