package com.lumen.grading.adapter;

import com.lumen.grading.exception.LmsDeliveryException;
import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.model.enums.LmsType;

/**
 * Interface for LMS-specific grade connectors.
 *
 * Each LMS (Canvas, Moodle, Blackboard) implements this interface; the sync
 * dispatcher picks the implementation by the integration's LmsType and knows
 * nothing else about it.
 */
public interface LmsConnector {

    /**
     * Get the LMS type this connector handles.
     */
    LmsType getLmsType();

    /**
     * Test the connection to the LMS.
     *
     * @param integration the integration configuration
     * @return result of the connection test
     */
    ConnectionTestResult testConnection(LmsIntegration integration);

    /**
     * Push one grade to the LMS gradebook.
     *
     * @param integration the integration configuration (read only)
     * @param push        what to write and where
     * @return acknowledgement from the LMS
     * @throws LmsDeliveryException if the LMS did not accept the grade
     */
    PushAck pushGrade(LmsIntegration integration, GradePush push);

    // ========================================================================
    // RESULT TYPES
    // ========================================================================

    /**
     * A grade addressed in LMS terms.
     */
    record GradePush(
            String externalCourseId,
            String externalStudentId,
            Long assignmentId,
            double score
    ) {}

    /**
     * Acknowledgement of an accepted grade.
     */
    record PushAck(
            String externalReference,
            String message
    ) {}

    /**
     * Result of a connection test.
     */
    record ConnectionTestResult(
            boolean success,
            String message,
            long responseTimeMs
    ) {
        public static ConnectionTestResult success(String message, long responseTime) {
            return new ConnectionTestResult(true, message, responseTime);
        }

        public static ConnectionTestResult failure(String message) {
            return new ConnectionTestResult(false, message, 0);
        }
    }
}
