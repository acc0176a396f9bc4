package com.example.jobscheduler.service.handler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobExecutionResult Tests")
class JobExecutionResultTest {

    @Test
    @DisplayName("Should create success result")
    void shouldCreateSuccessResult() {
        var result = JobExecutionResult.success();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getErrorMessage()).isNull();
    }

    @Test
    @DisplayName("Should classify failures from exceptions")
    void shouldCreateFailureFromException() {
        var result = JobExecutionResult.failure(new IllegalStateException("bad state"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("bad state");
        assertThat(result.getErrorType()).isEqualTo("IllegalStateException");
    }

    @Test
    @DisplayName("Should fall back to the exception class when there is no message")
    void shouldUseClassNameWithoutMessage() {
        var result = JobExecutionResult.failure(new NullPointerException());

        assertThat(result.getErrorMessage()).isEqualTo("java.lang.NullPointerException");
    }

    @Test
    @DisplayName("Should truncate very long error messages")
    void shouldTruncateLongMessages() {
        var result = JobExecutionResult.failure("x".repeat(5000));

        assertThat(result.getErrorMessage()).hasSize(2003).endsWith("...");
    }

    @Test
    @DisplayName("Should describe timeouts")
    void shouldCreateTimeoutResult() {
        var result = JobExecutionResult.timeout(250);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo("TIMEOUT");
        assertThat(result.getErrorMessage()).contains("250ms");
    }
}
