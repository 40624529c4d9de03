package com.lumen.grading.model.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SubmissionStateTest {

    @Test
    void happyPathTransitionsAreAllowed() {
        assertThat(SubmissionState.NEW.canTransitionTo(SubmissionState.EXTRACTING)).isTrue();
        assertThat(SubmissionState.EXTRACTING.canTransitionTo(SubmissionState.EXTRACTED)).isTrue();
        assertThat(SubmissionState.EXTRACTED.canTransitionTo(SubmissionState.EVALUATING)).isTrue();
        assertThat(SubmissionState.EVALUATING.canTransitionTo(SubmissionState.EVALUATED)).isTrue();
        assertThat(SubmissionState.EVALUATED.canTransitionTo(SubmissionState.GRADED)).isTrue();
        assertThat(SubmissionState.GRADED.canTransitionTo(SubmissionState.SYNCED)).isTrue();
    }

    @Test
    void noBackwardOrSkippingTransitions() {
        assertThat(SubmissionState.SYNCED.canTransitionTo(SubmissionState.GRADED)).isFalse();
        assertThat(SubmissionState.NEW.canTransitionTo(SubmissionState.EVALUATING)).isFalse();
        assertThat(SubmissionState.EXTRACTED.canTransitionTo(SubmissionState.GRADED)).isFalse();
        assertThat(SubmissionState.CANCELLED.canTransitionTo(SubmissionState.EXTRACTING)).isFalse();
    }

    @Test
    void failedStatesOnlyReenterTheirStage() {
        assertThat(SubmissionState.EXTRACTION_FAILED.canTransitionTo(SubmissionState.EXTRACTING)).isTrue();
        assertThat(SubmissionState.EXTRACTION_FAILED.canTransitionTo(SubmissionState.EXTRACTED)).isFalse();
        assertThat(SubmissionState.EVALUATION_FAILED.canTransitionTo(SubmissionState.EXTRACTED)).isTrue();
        assertThat(SubmissionState.EVALUATION_FAILED.canTransitionTo(SubmissionState.EVALUATED)).isFalse();
    }

    @Test
    void gradedStatesCannotBeCancelled() {
        assertThat(SubmissionState.EVALUATED.isCancellable()).isTrue();
        assertThat(SubmissionState.GRADED.isCancellable()).isFalse();
        assertThat(SubmissionState.SYNCED.isCancellable()).isFalse();
        assertThat(SubmissionState.EXTRACTION_FAILED.isCancellable()).isFalse();
    }

    @Test
    void extractedTextPresenceFollowsTheLifecycle() {
        assertThat(SubmissionState.NEW.hasExtractedText()).isFalse();
        assertThat(SubmissionState.EXTRACTING.hasExtractedText()).isFalse();
        assertThat(SubmissionState.EXTRACTION_FAILED.hasExtractedText()).isFalse();
        assertThat(SubmissionState.EXTRACTED.hasExtractedText()).isTrue();
        assertThat(SubmissionState.EVALUATION_FAILED.hasExtractedText()).isTrue();
        assertThat(SubmissionState.SYNCED.hasExtractedText()).isTrue();
    }
}
