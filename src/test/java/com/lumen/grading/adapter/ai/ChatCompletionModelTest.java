package com.lumen.grading.adapter.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.ModelUnavailableException;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class ChatCompletionModelTest {

    private MockWebServer server;
    private ChatCompletionModel model;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        GradingProperties properties = new GradingProperties();
        properties.getEvaluation().setBaseUrl(server.url("/v1").toString());
        properties.getEvaluation().setApiKey("sk-test");
        properties.getEvaluation().setModel("test-model");
        properties.getEvaluation().setTimeoutSeconds(2);

        model = new ChatCompletionModel(WebClient.builder(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void returnsTheFirstChoiceContent() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"score\\\": 72}\"}}]}"));

        String content = model.complete("Evaluate this");

        assertThat(content).isEqualTo("{\"score\": 72}");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getBody().readUtf8()).contains("\"model\":\"test-model\"").contains("Evaluate this");
        assertThat(model.modelId()).isEqualTo("test-model");
    }

    @Test
    void unexpectedShapeGivesEmptyText() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[]}"));

        assertThat(model.complete("Evaluate this")).isEmpty();
    }

    @Test
    void rateLimitIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThatThrownBy(() -> model.complete("Evaluate this"))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("429");
    }

    @Test
    void serverErrorIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> model.complete("Evaluate this")).isInstanceOf(ModelUnavailableException.class);
    }
}
