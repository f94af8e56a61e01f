package com.jreinhal.covenant.exception;

import com.jreinhal.covenant.util.LogSanitizer;

public class DocumentBusyException extends RuntimeException {
    public DocumentBusyException(String documentId) {
        super("Document is currently being processed: " + LogSanitizer.documentId(documentId));
    }
}
