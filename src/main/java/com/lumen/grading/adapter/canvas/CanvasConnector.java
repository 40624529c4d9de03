package com.lumen.grading.adapter.canvas;

import java.util.Map;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.lumen.grading.adapter.AbstractLmsConnector;
import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.model.enums.LmsType;
import com.lumen.grading.service.CredentialCipher;

import lombok.extern.slf4j.Slf4j;

/**
 * Connector for Canvas LMS.
 *
 * Grades are posted to the assignment submission of the student, addressed
 * by SIS user id:
 * PUT /api/v1/courses/:course_id/assignments/:assignment_id/submissions/sis_user_id::sis_id
 *
 * @see <a href="https://canvas.instructure.com/doc/api/submissions.html">Canvas Submissions API</a>
 */
@Component
@Slf4j
public class CanvasConnector extends AbstractLmsConnector {

    public CanvasConnector(WebClient.Builder webClientBuilder,
                           CredentialCipher credentialCipher,
                           GradingProperties properties) {
        super(webClientBuilder, credentialCipher, properties);
    }

    @Override
    public LmsType getLmsType() {
        return LmsType.CANVAS;
    }

    @Override
    public ConnectionTestResult testConnection(LmsIntegration integration) {
        log.info("Testing Canvas connection for: {}", integration.getConnectionName());

        try {
            long startTime = System.currentTimeMillis();

            Map<?, ?> course = createBearerClient(integration).get()
                    .uri("/api/v1/courses/{courseId}", integration.getExternalCourseId())
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout())
                    .block();

            long responseTime = System.currentTimeMillis() - startTime;

            if (course != null && course.containsKey("id")) {
                return ConnectionTestResult.success("Connected to Canvas course: " + course.get("name"), responseTime);
            }
            return ConnectionTestResult.failure("Canvas course not found");

        } catch (Exception e) {
            log.error("Canvas connection test failed: {}", e.getMessage());
            return ConnectionTestResult.failure("Connection failed: " + e.getMessage());
        }
    }

    @Override
    public PushAck pushGrade(LmsIntegration integration, GradePush push) {
        log.debug("Posting grade {} for {} to Canvas course {}",
                push.score(), push.externalStudentId(), push.externalCourseId());

        Map<String, Object> body = Map.of(
                "submission", Map.of("posted_grade", push.score())
        );

        try {
            Map<?, ?> response = createBearerClient(integration).put()
                    .uri("/api/v1/courses/{courseId}/assignments/{assignmentId}/submissions/sis_user_id:{studentId}",
                            push.externalCourseId(), push.assignmentId(), push.externalStudentId())
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout())
                    .block();

            String reference = response != null && response.get("id") != null ? String.valueOf(response.get("id")) : null;
            return new PushAck(reference, "Grade synced to Canvas");

        } catch (Exception e) {
            throw translate(e);
        }
    }
}
