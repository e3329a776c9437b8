package com.phillippitts.aerodefect.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Job admission and deadline settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>inspection.max-concurrent-jobs - jobs allowed past the queue at once (default: 5)</li>
 *   <li>inspection.job-deadline-ms - time budget for preprocessing plus detection (default: 10000)</li>
 *   <li>inspection.slow-job-warn-ms - a job slower than this logs a performance warning (default: 30000)</li>
 *   <li>inspection.queue-timeout-ms - max wait for a slot; 0 waits indefinitely (default: 0)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "inspection")
public record InspectionProperties(
        @Positive @DefaultValue("5") int maxConcurrentJobs,
        @Positive @DefaultValue("10000") long jobDeadlineMs,
        @Positive @DefaultValue("30000") long slowJobWarnMs,
        @Min(0) @DefaultValue("0") long queueTimeoutMs
) {

    public static InspectionProperties defaults() {
        return new InspectionProperties(5, 10_000, 30_000, 0);
    }
}
