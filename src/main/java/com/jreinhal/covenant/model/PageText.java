package com.jreinhal.covenant.model;

/**
 * Plain text of one page. Page numbers are 1-based.
 */
public record PageText(int pageNum, String text, boolean ocr) {

    public PageText(int pageNum, String text) {
        this(pageNum, text, false);
    }

    public PageText {
        if (pageNum < 1) {
            throw new IllegalArgumentException("Page numbers are 1-based");
        }
        text = text == null ? "" : text;
    }
}
