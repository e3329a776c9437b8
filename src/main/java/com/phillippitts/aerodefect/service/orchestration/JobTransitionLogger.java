package com.phillippitts.aerodefect.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Debug trace of every job state change.
 */
@Component
public class JobTransitionLogger implements JobStateListener {

    private static final Logger LOG = LogManager.getLogger(JobTransitionLogger.class);

    @Override
    public void onTransition(InspectionJob job, JobState from, JobState to) {
        if (to == JobState.FAILED) {
            LOG.debug("Job {}: {} -> {} ({})", job.getId(), from, to, job.getFailureReason());
        } else {
            LOG.debug("Job {}: {} -> {} after {} ms", job.getId(), from, to, job.elapsedMs());
        }
    }
}
