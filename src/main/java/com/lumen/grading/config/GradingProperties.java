package com.lumen.grading.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for the grading pipeline.
 *
 * Bound once at startup; pipeline components read it and never write it.
 */
@Data
@ConfigurationProperties(prefix = "lumen.grading")
public class GradingProperties {

    /**
     * OCR engine configuration
     */
    private OcrConfig ocr = new OcrConfig();

    /**
     * AI evaluation model configuration
     */
    private EvaluationConfig evaluation = new EvaluationConfig();

    /**
     * Backoff for extraction and evaluation retries
     */
    private RetryConfig retry = new RetryConfig();

    /**
     * LMS sync configuration
     */
    private SyncConfig sync = new SyncConfig();

    /**
     * Scheduler and worker pool configuration
     */
    private PipelineConfig pipeline = new PipelineConfig();

    /**
     * Upload storage configuration
     */
    private UploadConfig uploads = new UploadConfig();

    /**
     * Encryption configuration
     */
    private EncryptionConfig encryption = new EncryptionConfig();

    @Data
    public static class OcrConfig {
        /**
         * OCR service base URL; images are POSTed to {baseUrl}/recognize
         */
        private String baseUrl = "http://localhost:8884";

        /**
         * Per-call timeout in seconds
         */
        private int timeoutSeconds = 30;

        /**
         * OCR output with fewer letters/digits than this is illegible
         */
        private int minCharacters = 10;

        /**
         * Pages of a PDF read at most; the rest are ignored
         */
        private int maxPdfPages = 30;

        /**
         * Resolution at which PDF pages without a text layer are rendered for OCR
         */
        private int pdfRenderDpi = 144;
    }

    @Data
    public static class EvaluationConfig {
        /**
         * Base URL of an OpenAI-compatible API
         */
        private String baseUrl = "https://api.openai.com/v1";

        /**
         * API key. In production, use environment variable: LUMEN_AI_API_KEY
         */
        private String apiKey;

        /**
         * Model identifier recorded on every evaluation result
         */
        private String model = "gpt-4o-mini";

        /**
         * Per-call timeout in seconds
         */
        private int timeoutSeconds = 60;

        /**
         * Maximum attempts on transient model failures
         */
        private int maxTransientAttempts = 3;

        /**
         * Maximum rejected outputs (the first retry uses the strict prompt)
         */
        private int maxRejectedAttempts = 2;

        /**
         * Rubric description sent with every evaluation
         */
        private String rubric = "You are an experienced English teacher. Judge grammar, vocabulary, "
                + "organization and clarity of the student's writing. Award a score between 0 and 100 "
                + "reflecting overall quality.";
    }

    @Data
    public static class RetryConfig {
        /**
         * Maximum attempts on retryable extraction failures
         */
        private int maxAttempts = 3;

        /**
         * Delay before the first retry in milliseconds
         */
        private long baseDelayMs = 2000;

        /**
         * Upper bound for any retry delay in milliseconds
         */
        private long maxDelayMs = 60000;

        /**
         * Backoff multiplier between consecutive retries
         */
        private double multiplier = 2.0;
    }

    @Data
    public static class SyncConfig {
        /**
         * Maximum delivery attempts per sync job
         */
        private int maxAttempts = 3;

        /**
         * Delay before the first retry in milliseconds
         */
        private long baseDelayMs = 5000;

        /**
         * Upper bound for any retry delay in milliseconds
         */
        private long maxDelayMs = 300000;

        /**
         * Per-call timeout for LMS requests in seconds
         */
        private int timeoutSeconds = 10;
    }

    @Data
    public static class PipelineConfig {
        /**
         * Enable the polling scheduler
         */
        private boolean schedulerEnabled = true;

        /**
         * Start processing right after a submission is created
         */
        private boolean dispatchOnCreate = true;

        /**
         * Delay between scheduler polls in milliseconds
         */
        private long pollIntervalMs = 5000;

        /**
         * Maximum submissions/sync jobs picked up per poll
         */
        private int batchSize = 50;

        /**
         * Worker threads processing submissions
         */
        private int workerThreads = 4;

        /**
         * How long a claimed stage is protected from being picked up again, in seconds
         */
        private int stageLeaseSeconds = 180;
    }

    @Data
    public static class UploadConfig {
        /**
         * Directory uploaded images are stored in
         */
        private String directory = "uploads";

        /**
         * Maximum accepted upload size in bytes
         */
        private long maxBytes = 10 * 1024 * 1024;
    }

    @Data
    public static class EncryptionConfig {
        /**
         * Master key for LMS API key encryption.
         * In production, use environment variable: LUMEN_MASTER_KEY
         */
        private String masterKey;
    }
}
