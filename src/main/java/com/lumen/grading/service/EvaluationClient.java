package com.lumen.grading.service;

import java.util.ArrayList;

import org.springframework.stereotype.Service;

import com.lumen.grading.adapter.ai.EvaluationModel;
import com.lumen.grading.exception.ModelUnavailableException;
import com.lumen.grading.model.domain.EvaluationResult;
import com.lumen.grading.model.enums.EvaluationOutcome;
import com.lumen.grading.repository.EvaluationResultRepository;
import com.lumen.grading.service.ModelResponseParser.ParsedEvaluation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one AI evaluation attempt and records it.
 *
 * Every attempt is persisted, whatever its outcome. The caller decides what
 * the outcome means for the submission.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvaluationClient {

    private final EvaluationModel evaluationModel;
    private final RubricPromptBuilder promptBuilder;
    private final ModelResponseParser responseParser;
    private final EvaluationResultRepository evaluationResultRepository;

    /**
     * Evaluate extracted text.
     *
     * @param submissionId  submission being evaluated
     * @param extractedText normalized text of the submission
     * @param attemptNumber attempt number allocated by the pipeline
     * @param strict        use the strict JSON-only prompt
     * @return the persisted result
     */
    public EvaluationResult evaluate(Long submissionId, String extractedText, int attemptNumber, boolean strict) {
        EvaluationResult result = EvaluationResult.builder()
                .submissionId(submissionId)
                .attemptNumber(attemptNumber)
                .modelId(evaluationModel.modelId())
                .strictPrompt(strict)
                .feedback(new ArrayList<>())
                .build();

        String prompt = promptBuilder.build(extractedText, strict);

        String raw;
        try {
            raw = evaluationModel.complete(prompt);
        } catch (ModelUnavailableException e) {
            log.warn("EVAL: Submission {} attempt {} failed transiently: {}", submissionId, attemptNumber, e.getMessage());
            result.setOutcome(EvaluationOutcome.TRANSIENT_FAILURE);
            result.setErrorDetail(truncate(e.getMessage()));
            return evaluationResultRepository.save(result);
        } catch (Exception e) {
            log.warn("EVAL: Submission {} attempt {} failed unexpectedly: {}", submissionId, attemptNumber, e.getMessage());
            result.setOutcome(EvaluationOutcome.TRANSIENT_FAILURE);
            result.setErrorDetail(truncate("Unexpected model error: " + e.getMessage()));
            return evaluationResultRepository.save(result);
        }

        ParsedEvaluation parsed = responseParser.parse(raw);
        if (!parsed.valid()) {
            log.warn("EVAL: Submission {} attempt {} rejected: {}", submissionId, attemptNumber, parsed.reason());
            result.setOutcome(EvaluationOutcome.REJECTED);
            result.setErrorDetail(truncate(parsed.reason()));
            return evaluationResultRepository.save(result);
        }

        result.setOutcome(EvaluationOutcome.SUCCESS);
        result.setScore(parsed.score());
        result.setScoreClamped(parsed.clamped());
        result.getFeedback().addAll(parsed.feedback());
        if (parsed.clamped()) {
            log.warn("EVAL: Submission {} attempt {} score out of range, clamped to {}",
                    submissionId, attemptNumber, parsed.score());
        }

        log.info("EVAL: Submission {} attempt {} scored {}", submissionId, attemptNumber, parsed.score());
        return evaluationResultRepository.save(result);
    }

    private static String truncate(String detail) {
        if (detail == null) {
            return null;
        }
        return detail.length() <= 500 ? detail : detail.substring(0, 500);
    }
}
