package com.lumen.grading.adapter.blackboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.lumen.grading.adapter.LmsConnector.ConnectionTestResult;
import com.lumen.grading.adapter.LmsConnector.GradePush;
import com.lumen.grading.adapter.LmsConnector.PushAck;
import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.LmsDeliveryException;
import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.model.enums.LmsType;
import com.lumen.grading.service.CredentialCipher;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class BlackboardConnectorTest {

    private MockWebServer server;
    private BlackboardConnector connector;
    private LmsIntegration integration;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        GradingProperties properties = new GradingProperties();
        properties.getEncryption().setMasterKey("connector-test-key");
        properties.getSync().setTimeoutSeconds(2);
        CredentialCipher cipher = new CredentialCipher(properties);
        cipher.init();

        connector = new BlackboardConnector(WebClient.builder(), cipher, properties);
        integration = LmsIntegration.builder()
                .id(3L)
                .lmsType(LmsType.BLACKBOARD)
                .connectionName("Blackboard test")
                .courseId(31L)
                .externalCourseId("_123_1")
                .apiBaseUrl(server.url("/").toString())
                .encryptedApiKey(cipher.encrypt("bb-token"))
                .build();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void patchesTheGradebookCell() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"userId\": \"_55_1\", \"columnId\": \"21\", \"score\": 64.5}"));

        PushAck ack = connector.pushGrade(integration, new GradePush("_123_1", "_55_1", 21L, 64.5));

        assertThat(ack.externalReference()).isEqualTo("21");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PATCH");
        assertThat(request.getPath()).isEqualTo("/learn/api/public/v1/courses/_123_1/gradebook/columns/21/users/_55_1");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer bb-token");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"score\":64.5}");
    }

    @Test
    void unauthorizedIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThatThrownBy(() -> connector.pushGrade(integration, new GradePush("_123_1", "_55_1", 21L, 64.5)))
                .isInstanceOfSatisfying(LmsDeliveryException.class, e -> assertThat(e.isTransientFailure()).isFalse());
    }

    @Test
    void connectionTestReportsVersion() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"learn\": {\"major\": 3900, \"minor\": 80}}"));

        ConnectionTestResult result = connector.testConnection(integration);

        assertThat(result.success()).isTrue();
        assertThat(result.message()).startsWith("Connected to Blackboard Learn");
    }

    @Test
    void connectionTestFailsOnServerError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        ConnectionTestResult result = connector.testConnection(integration);

        assertThat(result.success()).isFalse();
    }
}
