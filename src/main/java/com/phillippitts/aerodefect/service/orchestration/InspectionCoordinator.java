package com.phillippitts.aerodefect.service.orchestration;

import com.phillippitts.aerodefect.config.properties.InspectionProperties;
import com.phillippitts.aerodefect.domain.EnsembleResult;
import com.phillippitts.aerodefect.domain.InspectionMetadata;
import com.phillippitts.aerodefect.exception.InferenceUnavailableException;
import com.phillippitts.aerodefect.exception.PreprocessingException;
import com.phillippitts.aerodefect.service.detection.primary.PrimaryDetectorAdapter;
import com.phillippitts.aerodefect.service.detection.secondary.SecondaryDetectorAdapter;
import com.phillippitts.aerodefect.service.ensemble.AggregatedDetections;
import com.phillippitts.aerodefect.service.ensemble.DetectionAggregator;
import com.phillippitts.aerodefect.service.metrics.InspectionMetrics;
import com.phillippitts.aerodefect.service.preprocessing.ImagePreprocessor;
import com.phillippitts.aerodefect.service.preprocessing.PreprocessedImage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives one {@link InspectionJob} through preprocessing, parallel detection and aggregation.
 *
 * <p>Failure rules:
 * <ul>
 *   <li>Preprocessing failure fails the job at once; no detector runs.</li>
 *   <li>One detector failing or missing the deadline degrades the result
 *       ({@code degraded=true} plus a warning) but the job completes.</li>
 *   <li>Both detectors failing fails the job with {@link InferenceUnavailableException}.</li>
 * </ul>
 *
 * <p>The deadline clock starts when the job leaves the queue; the detection wait uses whatever
 * remains of it after preprocessing. A job whose total time, queue wait included, exceeds
 * {@code inspection.slow-job-warn-ms} logs a performance warning; that threshold never aborts anything.
 */
@Service
public class InspectionCoordinator {

    private static final Logger LOG = LogManager.getLogger(InspectionCoordinator.class);

    private final ImagePreprocessor preprocessor;
    private final ParallelDetectionService detectionService;
    private final DetectionAggregator aggregator;
    private final InspectionProperties properties;
    private final InspectionMetrics metrics;

    public InspectionCoordinator(ImagePreprocessor preprocessor,
                                 ParallelDetectionService detectionService,
                                 DetectionAggregator aggregator,
                                 InspectionProperties properties,
                                 InspectionMetrics metrics) {
        this.preprocessor = Objects.requireNonNull(preprocessor);
        this.detectionService = Objects.requireNonNull(detectionService);
        this.aggregator = Objects.requireNonNull(aggregator);
        this.properties = Objects.requireNonNull(properties);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Runs the job to a terminal state.
     *
     * @param job        a job in {@link JobState#QUEUED}
     * @param imageBytes encoded image
     * @return the final result; the job is {@link JobState#COMPLETED}
     * @throws PreprocessingException        if the image is unusable; the job is {@link JobState#FAILED}
     * @throws InferenceUnavailableException if both detectors failed; the job is {@link JobState#FAILED}
     */
    public EnsembleResult run(InspectionJob job, byte[] imageBytes) {
        try {
            return doRun(job, imageBytes);
        } catch (PreprocessingException e) {
            job.fail(e.getMessage());
            metrics.recordJobFailed("invalid_image");
            LOG.warn("Job {} rejected: {}", job.getId(), e.getMessage());
            throw e;
        } catch (InferenceUnavailableException e) {
            job.fail(e.getMessage());
            metrics.recordJobFailed("inference_unavailable");
            LOG.error("Job {} failed: {}", job.getId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            if (job.fail(e.getMessage())) {
                metrics.recordJobFailed("error");
            }
            throw e;
        } finally {
            warnIfSlow(job);
        }
    }

    private EnsembleResult doRun(InspectionJob job, byte[] imageBytes) {
        job.transitionTo(JobState.PREPROCESSING);
        PreprocessedImage image = preprocessor.preprocess(imageBytes);
        List<String> warnings = new ArrayList<>(image.warnings());

        job.transitionTo(JobState.DETECTING);
        long budgetMs = job.remainingMs();
        if (budgetMs <= 0) {
            LOG.warn("Job {} used its whole {} ms deadline in preprocessing", job.getId(), job.getDeadlineMs());
        }
        ParallelDetectionService.DetectionPair pair = detectionService.detectBoth(image, budgetMs);
        job.recordResults(pair.primary(), pair.secondary());
        metrics.recordDetector(PrimaryDetectorAdapter.DETECTOR_NAME, pair.primary());
        metrics.recordDetector(SecondaryDetectorAdapter.DETECTOR_NAME, pair.secondary());

        if (pair.bothFailed()) {
            throw new InferenceUnavailableException(pair.primary().error(), pair.secondary().error());
        }
        boolean degraded = pair.anyFailed();
        if (pair.primary().isFailed()) {
            warnings.add("Primary detector unavailable: " + pair.primary().error());
        }
        if (pair.secondary().isFailed()) {
            warnings.add("Secondary detector unavailable: " + pair.secondary().error());
        }

        job.transitionTo(JobState.AGGREGATING);
        AggregatedDetections aggregated = aggregator.aggregate(
                pair.primary().detections(), pair.secondary().detections());
        warnings.addAll(aggregated.warnings());

        long elapsed = job.processingMs();
        InspectionMetadata metadata = new InspectionMetadata(
                job.getInspectionId(),
                job.getId(),
                pair.primary().size(),
                pair.secondary().size(),
                aggregated.detections().size(),
                new InspectionMetadata.Dimensions(image.width(), image.height()));
        EnsembleResult result = new EnsembleResult(aggregated.detections(), elapsed, degraded, warnings,
                image.qualityScore(), metadata);

        job.transitionTo(JobState.COMPLETED);
        metrics.recordJobCompleted(elapsed, degraded, result.detections());
        LOG.info("Job {} completed in {} ms: {} defects (primary={}, secondary={}, degraded={})",
                job.getId(), elapsed, result.detections().size(), pair.primary().size(), pair.secondary().size(),
                degraded);
        return result;
    }

    private void warnIfSlow(InspectionJob job) {
        long elapsed = job.elapsedMs();
        if (elapsed > properties.slowJobWarnMs()) {
            LOG.warn("Job {} took {} ms (slow-job threshold {} ms, state {})",
                    job.getId(), elapsed, properties.slowJobWarnMs(), job.getState());
        }
    }
}
