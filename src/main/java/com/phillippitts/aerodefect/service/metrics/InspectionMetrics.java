package com.phillippitts.aerodefect.service.metrics;

import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSet;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for inspection jobs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Detector latency and success/failure per detector (primary, secondary)</li>
 *   <li>Job outcomes (completed, degraded, failed by reason) and end-to-end latency</li>
 *   <li>Final defect counts by source</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class InspectionMetrics {

    private static final String DETECTOR_PREFIX = "aerodefect.detector";
    private static final String JOB_PREFIX = "aerodefect.job";

    private final MeterRegistry registry;

    public InspectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency and outcome of one detector branch.
     *
     * @param detectorName primary or secondary
     * @param result       the branch output
     */
    public void recordDetector(String detectorName, DetectionSet result) {
        Timer.builder(DETECTOR_PREFIX + ".latency")
                .description("Time spent in a detector for one job")
                .tag("detector", detectorName)
                .register(registry)
                .record(result.latencyMs(), TimeUnit.MILLISECONDS);
        String outcome = result.isFailed() ? "failure" : "success";
        Counter.builder(DETECTOR_PREFIX + "." + outcome)
                .description("Number of detector invocations by outcome")
                .tag("detector", detectorName)
                .register(registry)
                .increment();
    }

    /**
     * Records a completed job and the sources of its final detections.
     */
    public void recordJobCompleted(long durationMs, boolean degraded, List<Detection> detections) {
        Timer.builder(JOB_PREFIX + ".latency")
                .description("End-to-end inspection time")
                .tag("outcome", degraded ? "degraded" : "completed")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        Counter.builder(JOB_PREFIX + (degraded ? ".degraded" : ".completed"))
                .description("Number of inspection jobs that produced a result")
                .register(registry)
                .increment();
        for (Detection d : detections) {
            Counter.builder(JOB_PREFIX + ".defects")
                    .description("Final defects reported, by source")
                    .tag("source", d.source().wireName())
                    .register(registry)
                    .increment();
        }
    }

    /**
     * @param reason invalid_image, inference_unavailable, capacity or error
     */
    public void recordJobFailed(String reason) {
        Counter.builder(JOB_PREFIX + ".failed")
                .description("Number of inspection jobs that failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
