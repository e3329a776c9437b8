package com.phillippitts.aerodefect.service.orchestration;

import com.phillippitts.aerodefect.config.properties.InspectionProperties;
import com.phillippitts.aerodefect.domain.EnsembleResult;
import com.phillippitts.aerodefect.exception.AeroDefectException;
import com.phillippitts.aerodefect.exception.CapacityExceededException;
import com.phillippitts.aerodefect.service.metrics.InspectionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for inspections: {@code submit(image) -> EnsembleResult | exception}.
 *
 * <p>Synchronous for the caller. Each submission becomes an {@link InspectionJob} that waits in the
 * {@link ConcurrencyGovernor} queue, then runs through the {@link InspectionCoordinator}. The job id is
 * placed in the Log4j2 {@link ThreadContext} as {@code jobId} for the duration of the call.
 */
@Service
public class InspectionService {

    private static final Logger LOG = LogManager.getLogger(InspectionService.class);

    public static final String JOB_ID_KEY = "jobId";

    private final ConcurrencyGovernor governor;
    private final InspectionCoordinator coordinator;
    private final InspectionProperties properties;
    private final InspectionMetrics metrics;
    private final List<JobStateListener> listeners;

    @Autowired
    public InspectionService(ConcurrencyGovernor governor,
                             InspectionCoordinator coordinator,
                             InspectionProperties properties,
                             InspectionMetrics metrics,
                             ObjectProvider<JobStateListener> listeners) {
        this(governor, coordinator, properties, metrics, listeners.orderedStream().toList());
    }

    public InspectionService(ConcurrencyGovernor governor,
                             InspectionCoordinator coordinator,
                             InspectionProperties properties,
                             InspectionMetrics metrics,
                             List<JobStateListener> listeners) {
        this.governor = Objects.requireNonNull(governor);
        this.coordinator = Objects.requireNonNull(coordinator);
        this.properties = Objects.requireNonNull(properties);
        this.metrics = Objects.requireNonNull(metrics);
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Inspects one image.
     *
     * @param imageBytes   encoded image
     * @param inspectionId caller correlation id, echoed in the result metadata (may be null)
     * @return full or degraded result
     * @throws com.phillippitts.aerodefect.exception.PreprocessingException        bad input image
     * @throws com.phillippitts.aerodefect.exception.InferenceUnavailableException both detectors failed
     * @throws CapacityExceededException                                          no slot within the queue timeout
     */
    public EnsembleResult submit(byte[] imageBytes, String inspectionId) {
        Objects.requireNonNull(imageBytes, "imageBytes");
        InspectionJob job = new InspectionJob(inspectionId, properties.jobDeadlineMs(), listeners);
        String previousJobId = ThreadContext.get(JOB_ID_KEY);
        ThreadContext.put(JOB_ID_KEY, job.getId());
        try {
            LOG.info("Job {} submitted ({} bytes, inspectionId={})", job.getId(), imageBytes.length, inspectionId);
            return governor.execute(() -> coordinator.run(job, imageBytes));
        } catch (CapacityExceededException e) {
            job.fail(e.getMessage());
            metrics.recordJobFailed("capacity");
            throw e;
        } catch (AeroDefectException e) {
            if (job.fail(e.getMessage())) {
                metrics.recordJobFailed("error");
            }
            throw e;
        } finally {
            if (previousJobId == null) {
                ThreadContext.remove(JOB_ID_KEY);
            } else {
                ThreadContext.put(JOB_ID_KEY, previousJobId);
            }
        }
    }
}
