package com.example.jobscheduler.client;

import com.example.jobscheduler.config.WebhookProperties;
import com.example.jobscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Delivers job payloads to the configured webhook endpoint.
 * <p>
 * Guarded by the {@code jobWebhook} circuit breaker. No client-side retry: a failed
 * delivery is a failed job attempt and the scheduler's retry policy takes over.
 */
@Slf4j
public class WebhookClient {

    private static final String SERVICE_NAME = "Webhook";

    private final WebClient webClient;
    private final WebhookProperties properties;

    public WebhookClient(@Qualifier("webhookWebClient") WebClient webClient, WebhookProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * POST the payload verbatim
     *
     * @return HTTP status code of the 2xx response
     * @throws ExternalServiceException on a non-2xx response or I/O failure
     */
    @CircuitBreaker(name = "jobWebhook", fallbackMethod = "deliverFallback")
    public int deliver(String payload) {
        try {
            var response = webClient.post()
                    .uri(properties.getUrl())
                    .bodyValue(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .toBodilessEntity()
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
            return response != null ? response.getStatusCode().value() : 200;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Webhook delivery to {} failed: {}", properties.getUrl(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    @SuppressWarnings("unused")
    private int deliverFallback(String payload, Exception e) {
        if (e instanceof ExternalServiceException ese) {
            throw ese;
        }
        log.warn("Circuit breaker open for webhook {}: {}", properties.getUrl(), e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Endpoint temporarily unavailable (circuit breaker open)", e);
    }
}
