package com.jreinhal.covenant.filter;

import com.jreinhal.covenant.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request's log lines with a correlation id taken from, or echoed back in,
 * the {@code X-Correlation-Id} header. Requests addressed to one document
 * ({@code /api/documents/{id}/...}) also carry that document id, so request and worker
 * log lines for the same contract line up.
 */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {
    public static final String HEADER_NAME = "X-Correlation-Id";
    public static final String MDC_KEY = "correlationId";
    private static final Pattern SAFE_CORRELATION_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,64}$");
    private static final Pattern DOCUMENT_PATH = Pattern.compile("/api/documents/([^/;?]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = request.getHeader(HEADER_NAME);
        if (correlationId == null || correlationId.isBlank() || !SAFE_CORRELATION_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_KEY, correlationId);
        String documentId = documentIdOf(request.getRequestURI());
        if (documentId != null) {
            MDC.put(LogSanitizer.DOCUMENT_ID_KEY, LogSanitizer.documentId(documentId));
        }
        response.setHeader(HEADER_NAME, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(LogSanitizer.DOCUMENT_ID_KEY);
        }
    }

    static String documentIdOf(String requestUri) {
        if (requestUri == null) {
            return null;
        }
        Matcher matcher = DOCUMENT_PATH.matcher(requestUri);
        return matcher.find() ? matcher.group(1) : null;
    }
}
