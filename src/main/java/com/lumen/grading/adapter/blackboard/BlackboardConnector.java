package com.lumen.grading.adapter.blackboard;

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
 * Connector for Blackboard Learn REST API.
 *
 * The assignment id of a submission is used as the gradebook column id.
 */
@Component
@Slf4j
public class BlackboardConnector extends AbstractLmsConnector {

    public BlackboardConnector(WebClient.Builder webClientBuilder,
                               CredentialCipher credentialCipher,
                               GradingProperties properties) {
        super(webClientBuilder, credentialCipher, properties);
    }

    @Override
    public LmsType getLmsType() {
        return LmsType.BLACKBOARD;
    }

    @Override
    public ConnectionTestResult testConnection(LmsIntegration integration) {
        log.info("Testing Blackboard connection for: {}", integration.getConnectionName());

        try {
            long startTime = System.currentTimeMillis();

            Map<?, ?> version = createBearerClient(integration).get()
                    .uri("/learn/api/public/v1/system/version")
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout())
                    .block();

            long responseTime = System.currentTimeMillis() - startTime;
            return ConnectionTestResult.success("Connected to Blackboard Learn " + (version != null ? version.get("learn") : ""),
                    responseTime);

        } catch (Exception e) {
            log.error("Blackboard connection test failed: {}", e.getMessage());
            return ConnectionTestResult.failure("Connection failed: " + e.getMessage());
        }
    }

    @Override
    public PushAck pushGrade(LmsIntegration integration, GradePush push) {
        log.debug("Posting grade {} for {} to Blackboard course {}",
                push.score(), push.externalStudentId(), push.externalCourseId());

        try {
            Map<?, ?> response = createBearerClient(integration).patch()
                    .uri("/learn/api/public/v1/courses/{courseId}/gradebook/columns/{columnId}/users/{userId}",
                            push.externalCourseId(), push.assignmentId(), push.externalStudentId())
                    .bodyValue(Map.of("score", push.score()))
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout())
                    .block();

            String reference = response != null && response.get("columnId") != null
                    ? String.valueOf(response.get("columnId")) : null;
            return new PushAck(reference, "Grade synced to Blackboard");

        } catch (Exception e) {
            throw translate(e);
        }
    }
}
