package com.jreinhal.covenant.model;

import java.util.List;

public record ExtractedDocument(List<PageText> pages) {

    public ExtractedDocument {
        pages = List.copyOf(pages);
    }

    public int pageCount() {
        return this.pages.size();
    }

    public int ocrPageCount() {
        return (int) this.pages.stream().filter(PageText::ocr).count();
    }

    public int textLength() {
        return this.pages.stream().mapToInt(p -> p.text().length()).sum();
    }
}
