package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.client.WebhookClient;
import com.example.jobscheduler.exception.ExternalServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookJobHandler Tests")
class WebhookJobHandlerTest {

    @Mock
    private WebhookClient webhookClient;

    @InjectMocks
    private WebhookJobHandler handler;

    @Test
    @DisplayName("Should deliver the payload verbatim and succeed on 2xx")
    void shouldSucceedOnAcceptedDelivery() {
        // Given
        var payload = "{\"orderId\":\"ORD-1\"}";
        when(webhookClient.deliver(payload)).thenReturn(202);

        // When
        var result = handler.execute(payload);

        // Then
        assertThat(result.isSuccess()).isTrue();
        verify(webhookClient).deliver(payload);
    }

    @Test
    @DisplayName("Should fail with the HTTP status of a rejected delivery")
    void shouldFailOnErrorStatus() {
        // Given
        when(webhookClient.deliver("x")).thenThrow(new ExternalServiceException("Webhook", 503, "down for maintenance"));

        // When
        var result = handler.execute("x");

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getHttpStatusCode()).isEqualTo(503);
        assertThat(result.getErrorType()).isEqualTo("HTTP_503");
        assertThat(result.getErrorMessage()).contains("down for maintenance");
    }

    @Test
    @DisplayName("Should fail on transport errors")
    void shouldFailOnTransportError() {
        // Given
        when(webhookClient.deliver("x")).thenThrow(new ExternalServiceException("Webhook", new IOException("connection refused")));

        // When
        var result = handler.execute("x");

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getHttpStatusCode()).isNull();
        assertThat(result.getErrorMessage()).contains("connection refused");
    }
}
