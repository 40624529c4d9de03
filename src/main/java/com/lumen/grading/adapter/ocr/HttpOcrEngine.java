package com.lumen.grading.adapter.ocr;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.OcrUnavailableException;
import com.lumen.grading.exception.UnreadableImageException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

/**
 * OCR engine reached over HTTP.
 *
 * The image is POSTed as application/octet-stream to {baseUrl}/recognize;
 * the service answers {"text": "..."}.
 */
@Component
@Slf4j
public class HttpOcrEngine implements OcrEngine {

    private final WebClient client;
    private final Duration timeout;

    public HttpOcrEngine(WebClient.Builder webClientBuilder, GradingProperties properties) {
        this.client = webClientBuilder.clone()
                .baseUrl(properties.getOcr().getBaseUrl())
                .build();
        this.timeout = Duration.ofSeconds(properties.getOcr().getTimeoutSeconds());
    }

    @Override
    public String recognize(byte[] image) {
        log.debug("Sending {} bytes to OCR engine", image.length);

        Map<?, ?> response;
        try {
            response = client.post()
                    .uri("/recognize")
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .bodyValue(image)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout)
                    .block();

        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (e.getStatusCode().is4xxClientError() && status != 408 && status != 429) {
                throw new UnreadableImageException("OCR engine rejected the image: " + status, e);
            }
            throw new OcrUnavailableException("OCR engine error: " + status, e);

        } catch (Exception e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException || e.getCause() instanceof TimeoutException) {
                throw new OcrUnavailableException("OCR engine timed out after " + timeout.toSeconds() + "s", e);
            }
            throw new OcrUnavailableException("OCR engine unreachable: " + e.getMessage(), e);
        }

        Object text = response != null ? response.get("text") : null;
        return text != null ? text.toString() : "";
    }
}
