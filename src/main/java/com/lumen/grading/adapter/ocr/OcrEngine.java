package com.lumen.grading.adapter.ocr;

import com.lumen.grading.exception.OcrUnavailableException;
import com.lumen.grading.exception.UnreadableImageException;

/**
 * Optical character recognition over a single image.
 */
public interface OcrEngine {

    /**
     * Recognize the text in an image.
     *
     * @param image raw image bytes (JPEG, PNG or GIF)
     * @return recognized text, possibly empty
     * @throws OcrUnavailableException  if the engine could not be reached or timed out
     * @throws UnreadableImageException if the engine refused the image
     */
    String recognize(byte[] image);
}
