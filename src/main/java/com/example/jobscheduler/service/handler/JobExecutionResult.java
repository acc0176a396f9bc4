package com.example.jobscheduler.service.handler;

import lombok.Builder;
import lombok.Data;

/**
 * Represents the result of a single job attempt.
 */
@Data
@Builder
public class JobExecutionResult {

    private static final int MAX_ERROR_LENGTH = 2000;

    /**
     * Whether the attempt was successful
     */
    private boolean success;

    /**
     * Error message if failed
     */
    private String errorMessage;

    /**
     * Error classification used as a metrics tag
     */
    private String errorType;

    /**
     * HTTP status code if applicable
     */
    private Integer httpStatusCode;

    public static JobExecutionResult success() {
        return JobExecutionResult.builder().success(true).build();
    }

    public static JobExecutionResult failure(String errorMessage) {
        return failure(errorMessage, "FAILURE");
    }

    public static JobExecutionResult failure(String errorMessage, String errorType) {
        return JobExecutionResult.builder()
                .success(false)
                .errorMessage(truncate(errorMessage))
                .errorType(errorType)
                .build();
    }

    /**
     * Create a failure result from exception
     */
    public static JobExecutionResult failure(Throwable e) {
        var message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        return failure(message, e.getClass().getSimpleName());
    }

    public static JobExecutionResult timeout(long timeoutMs) {
        return failure("Execution exceeded timeout of " + timeoutMs + "ms", "TIMEOUT");
    }

    public static JobExecutionResult httpFailure(int statusCode, String errorMessage) {
        return JobExecutionResult.builder()
                .success(false)
                .errorMessage(truncate(errorMessage))
                .errorType("HTTP_" + statusCode)
                .httpStatusCode(statusCode)
                .build();
    }

    /**
     * Keep stored error messages bounded
     */
    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH) + "...";
    }
}
