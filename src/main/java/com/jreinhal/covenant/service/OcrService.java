package com.jreinhal.covenant.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.covenant.exception.ExtractionException;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the OCR microservice used on image-only PDF pages.
 *
 * Configuration:
 *   covenant.ocr.enabled: true/false
 *   covenant.ocr.service-url: http://localhost:8090
 *   covenant.ocr.timeout-seconds: 60
 */
@Service
public class OcrService {
    private static final Logger log = LoggerFactory.getLogger(OcrService.class);

    private final RestTemplate restTemplate;
    private final boolean enabled;
    private final String serviceUrl;
    private final int maxTokensPerPage;

    public OcrService(
            @Value("${covenant.ocr.enabled:false}") boolean enabled,
            @Value("${covenant.ocr.service-url:http://localhost:8090}") String serviceUrl,
            @Value("${covenant.ocr.timeout-seconds:60}") int timeoutSeconds,
            @Value("${covenant.ocr.max-tokens-per-page:2048}") int maxTokensPerPage) {
        this.enabled = enabled;
        this.serviceUrl = serviceUrl;
        this.maxTokensPerPage = maxTokensPerPage;
        this.restTemplate = createRestTemplate(timeoutSeconds);
    }

    // No redirects: the configured URL is the only host page images are sent to.
    private static RestTemplate createRestTemplate(int timeoutSeconds) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        int timeoutMs = Math.max(1, timeoutSeconds) * 1000;
        factory.setConnectTimeout(Math.min(timeoutMs, 10_000));
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    /**
     * OCR one rendered page.
     *
     * @throws ExtractionException when the service fails, times out or returns no body
     */
    public String recognizePage(byte[] pngBytes, int pageNumber) {
        if (!this.enabled) {
            throw new ExtractionException("Page " + pageNumber + " has no text layer and OCR is disabled");
        }
        OcrImageRequest request = new OcrImageRequest();
        request.imageBase64 = Base64.getEncoder().encodeToString(pngBytes);
        request.maxTokens = this.maxTokensPerPage;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<OcrResponse> response = this.restTemplate.postForEntity(
                    this.serviceUrl + "/ocr/image", new HttpEntity<>(request, headers), OcrResponse.class);
            OcrResponse body = response.getBody();
            if (body == null || body.text == null) {
                throw new ExtractionException("OCR service returned no text for page " + pageNumber);
            }
            log.info(">> OCR: extracted {} chars from page {} in {}ms", body.text.length(), pageNumber, body.processingTimeMs);
            return body.text;
        } catch (RestClientException e) {
            throw new ExtractionException("OCR failed for page " + pageNumber + ": " + e.getMessage(), e);
        }
    }

    static class OcrImageRequest {
        @JsonProperty("image_base64")
        public String imageBase64;
        @JsonProperty("max_tokens")
        public int maxTokens;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OcrResponse {
        @JsonProperty("text")
        public String text;
        @JsonProperty("processing_time_ms")
        public long processingTimeMs;
    }
}
