package com.jreinhal.covenant.service;

import com.jreinhal.covenant.config.IngestionProperties;
import com.jreinhal.covenant.exception.ExtractionException;
import com.jreinhal.covenant.model.DocumentType;
import com.jreinhal.covenant.model.ExtractedDocument;
import com.jreinhal.covenant.model.PageText;
import com.jreinhal.covenant.util.LogSanitizer;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * Turns uploaded bytes into page-numbered plain text.
 *
 * <p>PDF pages are read from their text layer with PDFBox. A page whose text layer has fewer
 * than {@code covenant.ingestion.min-chars-per-page} characters is rendered and sent to OCR.
 * DOCX goes through Tika and, having no reliable page breaks, becomes a single page.</p>
 *
 * <p>Never returns a document without text: unreadable, unsupported or text-free input raises
 * {@link ExtractionException} with a reason suitable for showing to a user.</p>
 */
@Service
public class DocumentTextExtractor {
    private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractor.class);
    private static final int MAX_TIKA_CHARS = 5_000_000;

    private final OcrService ocrService;
    private final PageRenderService pageRenderService;
    private final IngestionProperties properties;
    private final Tika tika = new Tika();

    public DocumentTextExtractor(OcrService ocrService, PageRenderService pageRenderService, IngestionProperties properties) {
        this.ocrService = ocrService;
        this.pageRenderService = pageRenderService;
        this.properties = properties;
    }

    /**
     * Resolves the declared type, falling back to the filename extension and then to content
     * sniffing when the declaration is missing.
     */
    public DocumentType resolveType(String declaredType, String filename, byte[] content) {
        DocumentType type = DocumentType.fromDeclared(declaredType);
        if (type == null && (declaredType == null || declaredType.isBlank())) {
            type = DocumentType.fromFilename(filename);
            if (type == null) {
                type = DocumentType.fromDeclared(this.tika.detect(content, filename));
            }
        }
        if (type == null) {
            throw new ExtractionException("Unsupported document type: "
                    + (declaredType == null || declaredType.isBlank() ? "unknown" : LogSanitizer.sanitize(declaredType)));
        }
        return type;
    }

    public ExtractedDocument extract(byte[] content, DocumentType type, String filename) {
        if (content == null || content.length == 0) {
            throw new ExtractionException("File is empty");
        }
        List<PageText> pages = switch (type) {
            case PDF -> this.extractPdf(content);
            case DOCX -> List.of(new PageText(1, this.extractWithTika(content, filename)));
            case TEXT -> List.of(new PageText(1, normalize(new String(content, StandardCharsets.UTF_8))));
        };
        if (pages.stream().allMatch(page -> page.text().isBlank())) {
            if (type == DocumentType.PDF && !this.ocrService.isEnabled()) {
                throw new ExtractionException("No extractable text: the file appears to be scanned and OCR is disabled");
            }
            throw new ExtractionException("No extractable text found in file");
        }
        ExtractedDocument extracted = new ExtractedDocument(pages);
        log.info(">> Extracted {} chars from {} page(s), {} via OCR", extracted.textLength(),
                extracted.pageCount(), extracted.ocrPageCount());
        return extracted;
    }

    private List<PageText> extractPdf(byte[] content) {
        try (PDDocument pdf = Loader.loadPDF(content)) {
            int pageCount = pdf.getNumberOfPages();
            if (pageCount == 0) {
                throw new ExtractionException("PDF contains no pages");
            }
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            List<PageText> pages = new ArrayList<>(pageCount);
            for (int pageNum = 1; pageNum <= pageCount; pageNum++) {
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                String text = normalize(stripper.getText(pdf));
                if (text.strip().length() >= this.properties.getMinCharsPerPage()) {
                    pages.add(new PageText(pageNum, text));
                } else {
                    pages.add(this.ocrFallback(pdf, pageNum, text));
                }
            }
            return pages;
        } catch (InvalidPasswordException e) {
            throw new ExtractionException("PDF is password protected", e);
        } catch (IOException e) {
            throw new ExtractionException("Unreadable or corrupt PDF: " + e.getMessage(), e);
        }
    }

    private PageText ocrFallback(PDDocument pdf, int pageNum, String nativeText) throws IOException {
        if (!this.ocrService.isEnabled()) {
            log.warn("Page {} has only {} chars of text and OCR is disabled", pageNum, nativeText.strip().length());
            return new PageText(pageNum, nativeText);
        }
        log.info(">> Page {} has no usable text layer, engaging OCR", pageNum);
        byte[] png = this.pageRenderService.renderPagePng(pdf, pageNum);
        String ocrText = normalize(this.ocrService.recognizePage(png, pageNum));
        if (ocrText.strip().length() > nativeText.strip().length()) {
            return new PageText(pageNum, ocrText, true);
        }
        return new PageText(pageNum, nativeText);
    }

    private String extractWithTika(byte[] content, String filename) {
        try {
            AutoDetectParser parser = new AutoDetectParser();
            ParseContext context = new ParseContext();
            SAXParserFactory spf = SAXParserFactory.newInstance();
            spf.setFeature("http://xml.org/sax/features/external-general-entities", false);
            spf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            spf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            context.set(SAXParserFactory.class, spf);
            Metadata metadata = new Metadata();
            if (filename != null) {
                metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            }
            BodyContentHandler handler = new BodyContentHandler(MAX_TIKA_CHARS);
            parser.parse(new ByteArrayInputStream(content), handler, metadata, context);
            return normalize(handler.toString());
        } catch (IOException | SAXException | TikaException | ParserConfigurationException e) {
            throw new ExtractionException("Unreadable or corrupt document: " + e.getMessage(), e);
        }
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.replace("\r\n", "\n").replace('\r', '\n').replace("\u0000", "");
        StringBuilder out = new StringBuilder(cleaned.length());
        for (String line : cleaned.split("\n", -1)) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(line.stripTrailing());
        }
        return out.toString().strip();
    }
}
