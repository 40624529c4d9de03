package com.lumen.grading.adapter.document;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import javax.imageio.ImageIO;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.UnreadableDocumentException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the text of uploaded PDF and Word (.docx) documents.
 *
 * PDF pages are read from their text layer. A page without one is rendered
 * to PNG so the caller can send it to OCR.
 */
@Component
@Slf4j
public class DocumentTextReader {

    private final int maxPdfPages;
    private final float renderDpi;

    public DocumentTextReader(GradingProperties properties) {
        this.maxPdfPages = Math.max(1, properties.getOcr().getMaxPdfPages());
        this.renderDpi = properties.getOcr().getPdfRenderDpi();
    }

    /**
     * @throws UnreadableDocumentException if the bytes are not a readable PDF
     */
    public List<PdfPage> readPdf(byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            int pageCount = document.getNumberOfPages();
            if (pageCount > maxPdfPages) {
                log.warn("PDF has {} pages, reading the first {}", pageCount, maxPdfPages);
                pageCount = maxPdfPages;
            }

            PDFTextStripper stripper = new PDFTextStripper();
            PDFRenderer renderer = null;
            List<PdfPage> pages = new ArrayList<>(pageCount);

            for (int index = 0; index < pageCount; index++) {
                stripper.setStartPage(index + 1);
                stripper.setEndPage(index + 1);
                String text = stripper.getText(document).strip();
                if (!text.isEmpty()) {
                    pages.add(PdfPage.withText(index + 1, text));
                    continue;
                }
                if (renderer == null) {
                    renderer = new PDFRenderer(document);
                }
                BufferedImage image = renderer.renderImageWithDPI(index, renderDpi, ImageType.RGB);
                pages.add(PdfPage.scanned(index + 1, toPng(image)));
            }
            return pages;

        } catch (IOException e) {
            throw new UnreadableDocumentException("PDF could not be read: " + e.getMessage(), e);
        }
    }

    /**
     * Paragraph text of a .docx file, one paragraph per line.
     *
     * @throws UnreadableDocumentException if the bytes are not a readable .docx
     */
    public String readDocx(byte[] content) {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
            return document.getParagraphs().stream()
                    .map(XWPFParagraph::getText)
                    .collect(Collectors.joining("\n"));
        } catch (IOException | RuntimeException e) {
            // POI signals a non-OOXML file with unchecked exceptions
            throw new UnreadableDocumentException("Word document could not be read: " + e.getMessage(), e);
        }
    }

    private static byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    /**
     * One PDF page: either its text layer or, when it has none, a rendered
     * image for OCR.
     */
    public record PdfPage(int number, String text, byte[] renderedImage) {

        static PdfPage withText(int number, String text) {
            return new PdfPage(number, text, null);
        }

        static PdfPage scanned(int number, byte[] renderedImage) {
            return new PdfPage(number, null, renderedImage);
        }

        public boolean needsOcr() {
            return text == null;
        }
    }
}
