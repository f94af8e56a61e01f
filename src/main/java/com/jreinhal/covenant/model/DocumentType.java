package com.jreinhal.covenant.model;

import java.util.Locale;

public enum DocumentType {
    PDF("application/pdf"),
    DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
    TEXT("text/plain");

    private final String mimeType;

    DocumentType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String getMimeType() {
        return this.mimeType;
    }

    /**
     * Maps a declared type (mime type, extension or enum name) to a supported type.
     *
     * @return the matching type, or {@code null} when the declaration is not recognised
     */
    public static DocumentType fromDeclared(String declared) {
        if (declared == null || declared.isBlank()) {
            return null;
        }
        String value = declared.trim().toLowerCase(Locale.ROOT);
        int semicolon = value.indexOf(';');
        if (semicolon > 0) {
            value = value.substring(0, semicolon).trim();
        }
        if (value.startsWith(".")) {
            value = value.substring(1);
        }
        return switch (value) {
            case "pdf", "application/pdf" -> PDF;
            case "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document" -> DOCX;
            case "txt", "text", "text/plain", "md", "text/markdown" -> TEXT;
            default -> null;
        };
    }

    public static DocumentType fromFilename(String filename) {
        if (filename == null) {
            return null;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return null;
        }
        return fromDeclared(filename.substring(dot + 1));
    }
}
