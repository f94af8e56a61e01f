package com.jreinhal.covenant.service;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Rasterises PDF pages for OCR.
 */
@Service
public class PageRenderService {

    private final int renderDpi;
    private final int maxOutputPixels;

    public PageRenderService(
            @Value("${covenant.ocr.render-dpi:200}") int renderDpi,
            @Value("${covenant.ocr.max-output-pixels:8000000}") int maxOutputPixels) {
        this.renderDpi = renderDpi;
        this.maxOutputPixels = maxOutputPixels;
    }

    /**
     * @param pageNumber 1-based page number
     */
    public byte[] renderPagePng(PDDocument document, int pageNumber) throws IOException {
        if (pageNumber <= 0 || pageNumber > document.getNumberOfPages()) {
            throw new IllegalArgumentException("Requested page is out of range.");
        }
        // Grayscale keeps payloads small; OCR does not need colour.
        BufferedImage rendered = new PDFRenderer(document).renderImageWithDPI(pageNumber - 1, this.renderDpi, ImageType.GRAY);
        return this.toPngBytes(this.downscaleIfNeeded(rendered));
    }

    private BufferedImage downscaleIfNeeded(BufferedImage image) {
        long pixels = (long) image.getWidth() * image.getHeight();
        if (this.maxOutputPixels <= 0 || pixels <= this.maxOutputPixels) {
            return image;
        }
        double scale = Math.sqrt((double) this.maxOutputPixels / (double) pixels);
        int outW = Math.max(1, (int) Math.floor(image.getWidth() * scale));
        int outH = Math.max(1, (int) Math.floor(image.getHeight() * scale));
        BufferedImage scaled = new BufferedImage(outW, outH, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = scaled.createGraphics();
        try {
            g.drawImage(image, 0, 0, outW, outH, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private byte[] toPngBytes(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
