package com.phillippitts.aerodefect.service.detection.secondary;

import com.phillippitts.aerodefect.config.properties.SecondaryDetectorProperties;
import com.phillippitts.aerodefect.domain.BoundingBox;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSet;
import com.phillippitts.aerodefect.exception.DetectorExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs the remote vision model for one job, with bounded retries.
 *
 * <p>Each attempt is a single {@link VisionClient#call}. Transient outcomes (timeouts, transport
 * errors, 5xx, 429, empty or unparseable answers) are retried per the {@link RetryPolicy}; permanent
 * ones (other 4xx, missing API key) stop immediately. Exhaustion yields a failed {@link DetectionSet};
 * nothing is thrown to the caller.
 */
@Component
public class SecondaryDetectorAdapter {

    private static final Logger LOG = LogManager.getLogger(SecondaryDetectorAdapter.class);

    public static final String DETECTOR_NAME = "secondary";

    private static final Duration UNBOUNDED = Duration.ofMillis(Long.MAX_VALUE);

    private static final Comparator<Detection> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(Detection::confidence).reversed();

    private final VisionClient client;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    @Autowired
    public SecondaryDetectorAdapter(VisionClient client, SecondaryDetectorProperties properties, Sleeper sleeper) {
        this(client, properties.retryPolicy(), sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public SecondaryDetectorAdapter(VisionClient client, RetryPolicy retryPolicy, Sleeper sleeper,
                                    DoubleSupplier random) {
        this.client = Objects.requireNonNull(client);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.random = Objects.requireNonNull(random);
    }

    /**
     * Same as {@link #detect(BufferedImage, List, Duration)} with no time budget.
     */
    public DetectionSet detect(BufferedImage image, List<BoundingBox> candidateRegions) {
        return detect(image, candidateRegions, UNBOUNDED);
    }

    /**
     * Analyzes one image. No retry is scheduled whose backoff would end past {@code budget}, and an
     * interrupted thread stops retrying at once.
     *
     * @param image            image to analyze, as uploaded
     * @param candidateRegions optional regions to point the model at; may be empty
     * @param budget           time the caller will wait for the result, measured from this call
     */
    public DetectionSet detect(BufferedImage image, List<BoundingBox> candidateRegions, Duration budget) {
        long start = System.nanoTime();
        long budgetMs = budget.toMillis();
        if (!client.isConfigured()) {
            LOG.warn("Secondary detector skipped: API key not configured");
            return DetectionSet.failure("secondary detector not configured (API key missing)", elapsedMs(start));
        }

        VisionRequest request;
        try {
            request = new VisionRequest(
                    VisionPromptBuilder.build(image.getWidth(), image.getHeight(), candidateRegions),
                    encodeJpeg(image));
        } catch (IOException e) {
            LOG.error("Failed to encode image for vision request", e);
            return DetectionSet.failure("image encoding failed: " + e.getMessage(), elapsedMs(start));
        }

        VisionCallResult last = null;
        int attempt = 0;
        while (true) {
            attempt++;
            VisionCallResult result = client.call(request);
            if (result.isSuccess()) {
                Optional<List<Detection>> parsed =
                        VisionResponseParser.parse(result.content(), image.getWidth(), image.getHeight());
                if (parsed.isPresent()) {
                    List<Detection> detections = new ArrayList<>(parsed.get());
                    detections.sort(BY_CONFIDENCE_DESC);
                    long latency = elapsedMs(start);
                    LOG.info("Secondary detector returned {} detections in {} ms (attempt {}/{})",
                            detections.size(), latency, attempt, retryPolicy.maxAttempts());
                    return DetectionSet.success(detections, latency);
                }
                result = VisionCallResult.failure(VisionCallResult.Status.MALFORMED_RESPONSE,
                        "no JSON detections in model answer");
            }
            last = result;
            LOG.warn("Vision call attempt {}/{} failed: {}", attempt, retryPolicy.maxAttempts(), result.describe());

            if (Thread.currentThread().isInterrupted()) {
                return DetectionSet.failure("secondary detector interrupted after attempt " + attempt,
                        elapsedMs(start));
            }
            if (!result.isRetryable() || !retryPolicy.canRetry(attempt)) {
                break;
            }
            Duration delay = retryPolicy.delayBeforeRetry(attempt, random);
            long remainingMs = budgetMs - elapsedMs(start);
            if (delay.toMillis() >= remainingMs) {
                LOG.warn("Not retrying vision call: backoff of {} ms does not fit the remaining {} ms",
                        delay.toMillis(), Math.max(0L, remainingMs));
                break;
            }
            LOG.info("Retrying vision call in {} ms", delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return DetectionSet.failure("secondary detector interrupted during backoff", elapsedMs(start));
            }
        }

        long latency = elapsedMs(start);
        String message = DetectorExceptionBuilder.create("Remote vision call failed")
                .detector(DETECTOR_NAME)
                .attempts(attempt)
                .durationMs(latency)
                .metadata("lastStatus", last.describe())
                .build()
                .getMessage();
        LOG.warn(message);
        return DetectionSet.failure(message, latency);
    }

    public boolean isConfigured() {
        return client.isConfigured();
    }

    static String encodeJpeg(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "jpg", out)) {
            throw new IOException("no JPEG writer available for image type " + image.getType());
        }
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
