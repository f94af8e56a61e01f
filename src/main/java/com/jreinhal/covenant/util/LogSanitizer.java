package com.jreinhal.covenant.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    /**
     * MDC key carrying the document a log line belongs to, set by request filters and ingestion workers.
     */
    public static final String DOCUMENT_ID_KEY = "documentId";

    // Control characters allow forged log lines
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern DOCUMENT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");
    private static final int MAX_VALUE_LENGTH = 200;

    private LogSanitizer() {
    }

    public static boolean isDocumentId(String value) {
        return value != null && DOCUMENT_ID.matcher(value).matches();
    }

    /**
     * Well-formed document ids are logged verbatim. Anything else is reduced to its length,
     * since a path variable can carry arbitrary client text.
     */
    public static String documentId(String value) {
        if (value == null) {
            return "none";
        }
        return isDocumentId(value) ? value : "[invalid,len=" + value.length() + "]";
    }

    /**
     * Questions may quote contract terms; log only their shape.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_VALUE_LENGTH ? cleaned.substring(0, MAX_VALUE_LENGTH) + "..." : cleaned;
    }
}
