package com.phillippitts.aerodefect.service.metrics;

import com.phillippitts.aerodefect.domain.BoundingBox;
import com.phillippitts.aerodefect.domain.DefectClass;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSet;
import com.phillippitts.aerodefect.domain.DetectionSource;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InspectionMetricsTest {

    private SimpleMeterRegistry registry;
    private InspectionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new InspectionMetrics(registry);
    }

    @Test
    void recordsDetectorOutcomeAndLatency() {
        metrics.recordDetector("primary", DetectionSet.success(List.of(), 120));
        metrics.recordDetector("secondary", DetectionSet.failure("timeout", 10_000));

        assertThat(registry.get("aerodefect.detector.success").tag("detector", "primary").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("aerodefect.detector.failure").tag("detector", "secondary").counter().count())
                .isEqualTo(1.0);
        Timer timer = registry.get("aerodefect.detector.latency").tag("detector", "primary").timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }

    @Test
    void recordsCompletedJobAndDefectSources() {
        metrics.recordJobCompleted(900, false, List.of(
                detection(DetectionSource.ENSEMBLE),
                detection(DetectionSource.ENSEMBLE),
                detection(DetectionSource.PRIMARY)));

        assertThat(registry.get("aerodefect.job.completed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("aerodefect.job.defects").tag("source", "ensemble").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("aerodefect.job.defects").tag("source", "primary").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("aerodefect.job.degraded").counter()).isNull();
    }

    @Test
    void degradedJobsAreCountedSeparately() {
        metrics.recordJobCompleted(500, true, List.of());

        assertThat(registry.get("aerodefect.job.degraded").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("aerodefect.job.latency").tag("outcome", "degraded").timer().count()).isEqualTo(1);
    }

    @Test
    void failuresAreTaggedByReason() {
        metrics.recordJobFailed("capacity");
        metrics.recordJobFailed("capacity");
        metrics.recordJobFailed("invalid_image");

        assertThat(registry.get("aerodefect.job.failed").tag("reason", "capacity").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("aerodefect.job.failed").tag("reason", "invalid_image").counter().count())
                .isEqualTo(1.0);
    }

    private static Detection detection(DetectionSource source) {
        return new Detection(DefectClass.SCRATCH, 0.9, new BoundingBox(0, 0, 10, 10), source);
    }
}
