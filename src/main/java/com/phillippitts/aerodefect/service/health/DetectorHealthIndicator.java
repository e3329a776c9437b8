package com.phillippitts.aerodefect.service.health;

import com.phillippitts.aerodefect.config.properties.PrimaryDetectorProperties;
import com.phillippitts.aerodefect.service.detection.primary.PrimaryDetectorAdapter;
import com.phillippitts.aerodefect.service.detection.secondary.SecondaryDetectorAdapter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Readiness of the two detector backends, exposed as {@code detectors} under /actuator/health.
 *
 * <p>Checks that the ONNX weights file exists (and whether it is loaded yet) and that the remote
 * vision endpoint has an API key. The service can answer in degraded mode with one backend, so the
 * indicator is DOWN only when neither is usable.
 */
@Component("detectors")
public class DetectorHealthIndicator implements HealthIndicator {

    private final PrimaryDetectorProperties primaryProperties;
    private final PrimaryDetectorAdapter primaryAdapter;
    private final SecondaryDetectorAdapter secondaryAdapter;

    public DetectorHealthIndicator(PrimaryDetectorProperties primaryProperties,
                                   PrimaryDetectorAdapter primaryAdapter,
                                   SecondaryDetectorAdapter secondaryAdapter) {
        this.primaryProperties = primaryProperties;
        this.primaryAdapter = primaryAdapter;
        this.secondaryAdapter = secondaryAdapter;
    }

    @Override
    public Health health() {
        Path modelPath = Path.of(primaryProperties.modelPath());
        boolean modelPresent = Files.isRegularFile(modelPath);
        boolean modelLoaded = primaryAdapter.isModelLoaded();
        boolean primaryUsable = modelPresent || modelLoaded;
        boolean secondaryUsable = secondaryAdapter.isConfigured();

        Health.Builder builder = primaryUsable || secondaryUsable ? Health.up() : Health.down();
        return builder
                .withDetail("primaryModel", modelStatus(modelPresent, modelLoaded, modelPath))
                .withDetail("secondaryEndpoint", secondaryUsable ? "configured" : "API key not configured")
                .withDetail("degraded", !(primaryUsable && secondaryUsable))
                .build();
    }

    private static String modelStatus(boolean present, boolean loaded, Path path) {
        if (loaded) {
            return "loaded from " + path.getFileName();
        }
        return present ? "available at " + path.getFileName() + " (not loaded yet)"
                : "NOT FOUND at " + path.getFileName();
    }
}
