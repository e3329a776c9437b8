package com.phillippitts.aerodefect.service.orchestration;

/**
 * Lifecycle of an {@link InspectionJob}.
 *
 * <pre>
 * QUEUED → PREPROCESSING → DETECTING → AGGREGATING → COMPLETED
 *    └──────────┴──────────────┴────────────┴──────→ FAILED
 * </pre>
 */
public enum JobState {
    QUEUED,
    PREPROCESSING,
    DETECTING,
    AGGREGATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * @return true if {@code next} is a legal successor of this state
     */
    public boolean canTransitionTo(JobState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
