package com.lumen.grading.adapter.moodle;

import java.util.function.UnaryOperator;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.grading.adapter.AbstractLmsConnector;
import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.LmsDeliveryException;
import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.model.enums.LmsType;
import com.lumen.grading.service.CredentialCipher;

import lombok.extern.slf4j.Slf4j;

/**
 * Connector for Moodle via its REST web services endpoint.
 *
 * Moodle answers HTTP 200 even for failures; errors come back as an
 * {"exception": ...} object or a non-empty "warnings" list, so the body is
 * inspected rather than the status.
 */
@Component
@Slf4j
public class MoodleConnector extends AbstractLmsConnector {

    private static final String ENDPOINT = "/webservice/rest/server.php";
    private static final int GRADE_UPDATE_OK = 0;

    private final ObjectMapper objectMapper;

    public MoodleConnector(WebClient.Builder webClientBuilder,
                           CredentialCipher credentialCipher,
                           GradingProperties properties,
                           ObjectMapper objectMapper) {
        super(webClientBuilder, credentialCipher, properties);
        this.objectMapper = objectMapper;
    }

    @Override
    public LmsType getLmsType() {
        return LmsType.MOODLE;
    }

    @Override
    public ConnectionTestResult testConnection(LmsIntegration integration) {
        log.info("Testing Moodle connection for: {}", integration.getConnectionName());

        try {
            long startTime = System.currentTimeMillis();
            JsonNode siteInfo = call(integration, "core_webservice_get_site_info", uri -> uri);
            long responseTime = System.currentTimeMillis() - startTime;

            return ConnectionTestResult.success(
                    "Connected to Moodle site: " + siteInfo.path("sitename").asText("unknown"), responseTime);

        } catch (Exception e) {
            log.error("Moodle connection test failed: {}", e.getMessage());
            return ConnectionTestResult.failure("Connection failed: " + e.getMessage());
        }
    }

    @Override
    public PushAck pushGrade(LmsIntegration integration, GradePush push) {
        log.debug("Posting grade {} for {} to Moodle course {}",
                push.score(), push.externalStudentId(), push.externalCourseId());

        JsonNode result = call(integration, "core_grades_update_grades", uri -> uri
                .queryParam("source", "lumen")
                .queryParam("courseid", push.externalCourseId())
                .queryParam("component", "mod_assign")
                .queryParam("activityid", push.assignmentId())
                .queryParam("itemnumber", 0)
                .queryParam("grades[0][studentid]", push.externalStudentId())
                .queryParam("grades[0][grade]", push.score()));

        if (result.isInt() && result.asInt() != GRADE_UPDATE_OK) {
            throw new LmsDeliveryException("MoodleGradeUpdateFailed", false,
                    "Moodle rejected the grade update (code " + result.asInt() + ")");
        }
        return new PushAck(null, "Grade synced to Moodle");
    }

    private JsonNode call(LmsIntegration integration, String function,
                          UnaryOperator<UriBuilder> params) {
        String body;
        try {
            body = createPlainClient(integration).post()
                    .uri(uri -> params.apply(uri.path(ENDPOINT)
                                    .queryParam("wstoken", apiKey(integration))
                                    .queryParam("wsfunction", function)
                                    .queryParam("moodlewsrestformat", "json"))
                            .build())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout())
                    .block();
        } catch (Exception e) {
            throw translate(e);
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(body == null || body.isBlank() ? "null" : body);
        } catch (Exception e) {
            throw new LmsDeliveryException("MoodleBadResponse", false, "Moodle returned non-JSON output", e);
        }

        if (node.hasNonNull("exception")) {
            throw new LmsDeliveryException("MoodleException", false,
                    "Moodle error " + node.path("errorcode").asText() + ": " + node.path("message").asText());
        }
        if (node.path("warnings").isArray() && !node.path("warnings").isEmpty()) {
            throw new LmsDeliveryException("MoodleWarning", false, "Moodle API warning: " + node.get("warnings"));
        }
        return node;
    }
}
