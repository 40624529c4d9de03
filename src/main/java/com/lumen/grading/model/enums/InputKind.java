package com.lumen.grading.model.enums;

/**
 * Shape of the raw submission input.
 */
public enum InputKind {

    /**
     * Typed text, evaluated as-is after light normalization
     */
    TEXT,

    /**
     * Scanned or photographed handwriting, run through OCR
     */
    IMAGE,

    /**
     * PDF or Word document; text layer first, OCR for pages without one
     */
    DOCUMENT
}
