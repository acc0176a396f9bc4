package com.example.jobscheduler.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    /**
     * Seconds from now until the job becomes due (default: immediately)
     */
    @PositiveOrZero(message = "Delay must not be negative")
    @Builder.Default
    private double delaySeconds = 0;

    /**
     * Opaque data handed to the job handler
     */
    @NotNull(message = "Payload is required")
    @Builder.Default
    private String payload = "";

    @Builder.Default
    private boolean recurring = false;

    /**
     * Seconds between runs of a recurring job
     */
    @PositiveOrZero(message = "Interval must not be negative")
    @Builder.Default
    private double intervalSeconds = 0;
}
