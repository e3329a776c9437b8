package com.phillippitts.aerodefect.config.properties;

import com.phillippitts.aerodefect.service.detection.secondary.RetryPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Remote vision-language model settings. Binds to {@code detector.secondary.*}.
 *
 * <p>The endpoint must speak the OpenAI chat-completions protocol. An empty {@code apiKey}
 * leaves the detector permanently unavailable (every call fails without retry).
 *
 * @param endpoint         chat-completions URL
 * @param apiKey           bearer token; blank when not configured
 * @param model            model name sent in the request
 * @param maxTokens        completion token limit
 * @param requestTimeoutMs hard per-call read timeout; keep it below {@code inspection.job-deadline-ms}
 * @param connectTimeoutMs connection timeout
 * @param maxAttempts      total attempts including the first call
 * @param baseDelayMs      backoff before the second attempt; doubles each attempt
 * @param maxDelayMs       backoff cap
 * @param jitter           random spread applied to each backoff, as a fraction (0 disables)
 */
@Validated
@ConfigurationProperties(prefix = "detector.secondary")
public record SecondaryDetectorProperties(
        @NotBlank @DefaultValue("https://api.openai.com/v1/chat/completions") String endpoint,
        @DefaultValue("") String apiKey,
        @NotBlank @DefaultValue("gpt-4o") String model,
        @Positive @DefaultValue("1000") int maxTokens,
        @Positive @DefaultValue("8000") int requestTimeoutMs,
        @Positive @DefaultValue("5000") int connectTimeoutMs,
        @Min(1) @DefaultValue("3") int maxAttempts,
        @Min(0) @DefaultValue("1000") long baseDelayMs,
        @Min(0) @DefaultValue("8000") long maxDelayMs,
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.2") double jitter
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs), jitter);
    }
}
