package com.lumen.grading.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.lumen.grading.adapter.document.DocumentTextReader;
import com.lumen.grading.adapter.document.DocumentTextReader.PdfPage;
import com.lumen.grading.adapter.ocr.OcrEngine;
import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.InvalidUploadException;
import com.lumen.grading.exception.OcrUnavailableException;
import com.lumen.grading.exception.UnreadableDocumentException;
import com.lumen.grading.exception.UnreadableImageException;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.enums.FailureReason;
import com.lumen.grading.model.enums.InputKind;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns typed text, a scanned image or an uploaded document into the text
 * that gets evaluated.
 *
 * Has no side effects; calling it twice with the same input gives the same
 * result, so the pipeline may retry it freely. Successful text never exceeds
 * {@link Submission#MAX_TEXT_LENGTH}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentExtractor {

    private final OcrEngine ocrEngine;
    private final UploadStore uploadStore;
    private final DocumentTextReader documentReader;
    private final TextNormalizer normalizer;
    private final GradingProperties properties;

    public ExtractionResult extract(SubmissionInput input) {
        ExtractionResult result = switch (input.kind()) {
            case TEXT -> extractTyped(input.rawText());
            case IMAGE -> extractImage(input.uploadRef());
            case DOCUMENT -> extractDocument(input.uploadRef());
        };
        return result.success() ? capped(result) : result;
    }

    private ExtractionResult extractTyped(String rawText) {
        String text = normalizer.normalizeTyped(rawText);
        if (text.isEmpty()) {
            return ExtractionResult.failure(FailureReason.BAD_INPUT, "Submitted text is blank");
        }
        return ExtractionResult.success(text);
    }

    private ExtractionResult extractImage(String imageRef) {
        byte[] image;
        try {
            image = uploadStore.load(imageRef);
        } catch (InvalidUploadException e) {
            log.warn("Cannot load image {}: {}", imageRef, e.getMessage());
            return ExtractionResult.failure(FailureReason.BAD_INPUT, e.getMessage());
        }
        if (image.length == 0) {
            return ExtractionResult.failure(FailureReason.BAD_INPUT, "Image is empty");
        }

        String recognized;
        try {
            recognized = ocrEngine.recognize(image);
        } catch (OcrUnavailableException e) {
            return ExtractionResult.failure(FailureReason.ENGINE_UNAVAILABLE, e.getMessage());
        } catch (UnreadableImageException e) {
            return ExtractionResult.failure(FailureReason.BAD_INPUT, e.getMessage());
        }

        String text = normalizer.normalizeOcr(recognized);
        return legibleOrFailure(text);
    }

    private ExtractionResult extractDocument(String documentRef) {
        byte[] content;
        try {
            content = uploadStore.load(documentRef);
        } catch (InvalidUploadException e) {
            log.warn("Cannot load document {}: {}", documentRef, e.getMessage());
            return ExtractionResult.failure(FailureReason.BAD_INPUT, e.getMessage());
        }
        if (content.length == 0) {
            return ExtractionResult.failure(FailureReason.BAD_INPUT, "Document is empty");
        }

        try {
            if ("docx".equals(UploadStore.extensionOf(documentRef))) {
                String text = normalizer.normalizeTyped(documentReader.readDocx(content));
                return text.isEmpty()
                        ? ExtractionResult.failure(FailureReason.BAD_INPUT, "Document contains no text")
                        : ExtractionResult.success(text);
            }
            return extractPdf(documentRef, documentReader.readPdf(content));
        } catch (UnreadableDocumentException e) {
            log.warn("Cannot read document {}: {}", documentRef, e.getMessage());
            return ExtractionResult.failure(FailureReason.BAD_INPUT, e.getMessage());
        } catch (OcrUnavailableException e) {
            return ExtractionResult.failure(FailureReason.ENGINE_UNAVAILABLE, e.getMessage());
        }
    }

    private ExtractionResult extractPdf(String documentRef, List<PdfPage> pages) {
        List<String> texts = new ArrayList<>(pages.size());
        boolean usedOcr = false;

        for (PdfPage page : pages) {
            String text;
            if (page.needsOcr()) {
                usedOcr = true;
                try {
                    text = normalizer.normalizeOcr(ocrEngine.recognize(page.renderedImage()));
                } catch (UnreadableImageException e) {
                    log.warn("Skipping page {} of {}: {}", page.number(), documentRef, e.getMessage());
                    continue;
                }
            } else {
                text = normalizer.normalizeTyped(page.text());
            }
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }

        String joined = String.join("\n\n", texts);
        if (usedOcr) {
            return legibleOrFailure(joined);
        }
        return joined.isEmpty()
                ? ExtractionResult.failure(FailureReason.BAD_INPUT, "Document contains no text")
                : ExtractionResult.success(joined);
    }

    private ExtractionResult legibleOrFailure(String text) {
        int minCharacters = properties.getOcr().getMinCharacters();
        if (normalizer.meaningfulLength(text) < minCharacters) {
            return ExtractionResult.failure(FailureReason.ILLEGIBLE,
                    "OCR found fewer than " + minCharacters + " letters or digits");
        }
        return ExtractionResult.success(text);
    }

    private ExtractionResult capped(ExtractionResult result) {
        String text = result.text();
        if (text.length() <= Submission.MAX_TEXT_LENGTH) {
            return result;
        }
        log.warn("Extracted text has {} characters, keeping the first {}", text.length(), Submission.MAX_TEXT_LENGTH);
        return ExtractionResult.success(TextNormalizer.truncate(text, Submission.MAX_TEXT_LENGTH));
    }

    // ========================================================================
    // INPUT/RESULT TYPES
    // ========================================================================

    /**
     * What the extractor needs from a submission.
     */
    public record SubmissionInput(
            InputKind kind,
            String rawText,
            String uploadRef
    ) {
        public static SubmissionInput of(Submission submission) {
            return new SubmissionInput(submission.getInputKind(), submission.getRawText(), submission.getUploadRef());
        }
    }

    /**
     * Extracted text, or the reason there is none.
     */
    public record ExtractionResult(
            boolean success,
            String text,
            FailureReason failureReason,
            String detail
    ) {
        public static ExtractionResult success(String text) {
            return new ExtractionResult(true, text, null, null);
        }

        public static ExtractionResult failure(FailureReason reason, String detail) {
            return new ExtractionResult(false, null, reason, detail);
        }

        public boolean retryable() {
            return !success && failureReason.isRetryable();
        }
    }
}
