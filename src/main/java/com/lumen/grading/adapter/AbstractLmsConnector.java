package com.lumen.grading.adapter;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.LmsDeliveryException;
import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.service.CredentialCipher;

import reactor.core.Exceptions;

/**
 * HTTP plumbing shared by the LMS connectors: client construction with the
 * decrypted API key, the per-call timeout and error classification.
 */
public abstract class AbstractLmsConnector implements LmsConnector {

    private final WebClient.Builder webClientBuilder;
    private final CredentialCipher credentialCipher;
    private final GradingProperties properties;

    protected AbstractLmsConnector(
            WebClient.Builder webClientBuilder,
            CredentialCipher credentialCipher,
            GradingProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.credentialCipher = credentialCipher;
        this.properties = properties;
    }

    protected Duration timeout() {
        return Duration.ofSeconds(properties.getSync().getTimeoutSeconds());
    }

    protected String apiKey(LmsIntegration integration) {
        return credentialCipher.decrypt(integration.getEncryptedApiKey());
    }

    /**
     * Client for LMSs that take a bearer token (Canvas, Blackboard).
     */
    protected WebClient createBearerClient(LmsIntegration integration) {
        return webClientBuilder.clone()
                .baseUrl(integration.resolveBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey(integration))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Client without auth headers (Moodle passes its token as a parameter).
     */
    protected WebClient createPlainClient(LmsIntegration integration) {
        return webClientBuilder.clone()
                .baseUrl(integration.resolveBaseUrl())
                .build();
    }

    /**
     * Translate a client failure into the sync error taxonomy.
     */
    protected LmsDeliveryException translate(Exception e) {
        if (e instanceof LmsDeliveryException delivery) {
            return delivery;
        }
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            boolean transientFailure = status == 408 || status == 429 || status >= 500;
            return new LmsDeliveryException("HttpStatus" + status, transientFailure,
                    getLmsType().getDisplayName() + " API error: " + status + " " + response.getStatusText(), e);
        }
        if (e instanceof WebClientRequestException) {
            return new LmsDeliveryException("ConnectionError", true,
                    getLmsType().getDisplayName() + " unreachable: " + e.getMessage(), e);
        }
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof TimeoutException || e.getCause() instanceof TimeoutException) {
            return new LmsDeliveryException("Timeout", true,
                    getLmsType().getDisplayName() + " did not answer within " + timeout().toSeconds() + "s", e);
        }
        return new LmsDeliveryException("UnexpectedError", true,
                getLmsType().getDisplayName() + " sync error: " + e.getMessage(), e);
    }
}
