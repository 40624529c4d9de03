package com.lumen.grading.adapter.ai;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.databind.JsonNode;
import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.ModelUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Evaluation model behind an OpenAI-compatible chat completions endpoint.
 */
@Component
@Slf4j
public class ChatCompletionModel implements EvaluationModel {

    private final WebClient client;
    private final String model;
    private final Duration timeout;

    public ChatCompletionModel(WebClient.Builder webClientBuilder, GradingProperties properties) {
        GradingProperties.EvaluationConfig config = properties.getEvaluation();

        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        } else {
            log.warn("No AI API key configured (lumen.grading.evaluation.api-key); evaluation calls will likely fail");
        }

        this.client = builder.build();
        this.model = config.getModel();
        this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
    }

    @Override
    public String complete(String prompt) {
        Map<String, Object> request = Map.of(
                "model", model,
                "temperature", 0,
                "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        JsonNode response;
        try {
            response = client.post()
                    .uri("/chat/completions")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();

        } catch (WebClientResponseException e) {
            throw new ModelUnavailableException("Model API error: " + e.getStatusCode().value(), e);
        } catch (Exception e) {
            throw new ModelUnavailableException("Model call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            return "";
        }
        return response.path("choices").path(0).path("message").path("content").asText("");
    }

    @Override
    public String modelId() {
        return model;
    }
}
