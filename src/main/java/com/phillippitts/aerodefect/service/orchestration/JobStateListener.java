package com.phillippitts.aerodefect.service.orchestration;

/**
 * Observer of job state transitions. Called on the thread performing the transition, after the
 * state has changed; implementations must be fast and must not throw.
 */
@FunctionalInterface
public interface JobStateListener {

    void onTransition(InspectionJob job, JobState from, JobState to);
}
