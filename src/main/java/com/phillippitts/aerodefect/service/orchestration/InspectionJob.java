package com.phillippitts.aerodefect.service.orchestration;

import com.phillippitts.aerodefect.domain.DetectionSet;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Transient per-submission state: id, deadline, current {@link JobState} and detector outputs.
 *
 * <p>Transitions are validated against {@link JobState#canTransitionTo} under a lock; an illegal
 * transition throws {@link IllegalStateException}. The deadline clock starts when the job leaves
 * {@link JobState#QUEUED}, so time spent waiting for a slot does not eat into it.
 */
public final class InspectionJob {

    private final String id;
    private final String inspectionId;
    private final long createdNanos;
    private final long deadlineMs;
    private final List<JobStateListener> listeners;

    private final Lock lock = new ReentrantLock();
    private JobState state = JobState.QUEUED;
    private volatile long admittedNanos;
    private DetectionSet primaryResult;
    private DetectionSet secondaryResult;
    private String failureReason;

    public InspectionJob(String inspectionId, long deadlineMs, List<JobStateListener> listeners) {
        this(UUID.randomUUID().toString(), inspectionId, deadlineMs, listeners);
    }

    InspectionJob(String id, String inspectionId, long deadlineMs, List<JobStateListener> listeners) {
        this.id = Objects.requireNonNull(id, "id");
        this.inspectionId = inspectionId;
        this.deadlineMs = deadlineMs;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.createdNanos = System.nanoTime();
    }

    /**
     * Moves the job to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transitionTo(JobState next) {
        Objects.requireNonNull(next, "next");
        JobState previous;
        lock.lock();
        try {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Job " + id + ": illegal transition " + state + " -> " + next);
            }
            previous = state;
            state = next;
            if (previous == JobState.QUEUED) {
                admittedNanos = System.nanoTime();
            }
        } finally {
            lock.unlock();
        }
        notifyListeners(previous, next);
    }

    /**
     * Marks the job failed unless it already reached a terminal state.
     *
     * @return true if this call moved the job to {@link JobState#FAILED}
     */
    public boolean fail(String reason) {
        JobState previous;
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            previous = state;
            state = JobState.FAILED;
            failureReason = reason;
        } finally {
            lock.unlock();
        }
        notifyListeners(previous, JobState.FAILED);
        return true;
    }

    public void recordResults(DetectionSet primary, DetectionSet secondary) {
        lock.lock();
        try {
            this.primaryResult = primary;
            this.secondaryResult = secondary;
        } finally {
            lock.unlock();
        }
    }

    public JobState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public DetectionSet getPrimaryResult() {
        lock.lock();
        try {
            return primaryResult;
        } finally {
            lock.unlock();
        }
    }

    public DetectionSet getSecondaryResult() {
        lock.lock();
        try {
            return secondaryResult;
        } finally {
            lock.unlock();
        }
    }

    public String getFailureReason() {
        lock.lock();
        try {
            return failureReason;
        } finally {
            lock.unlock();
        }
    }

    public String getId() {
        return id;
    }

    public String getInspectionId() {
        return inspectionId;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }

    /**
     * @return time since submission, queue wait included
     */
    public long elapsedMs() {
        return (System.nanoTime() - createdNanos) / 1_000_000L;
    }

    /**
     * @return time since the job left the queue; 0 while still queued
     */
    public long processingMs() {
        long admitted = admittedNanos;
        return admitted == 0L ? 0L : (System.nanoTime() - admitted) / 1_000_000L;
    }

    /**
     * @return milliseconds left before the deadline; zero or negative once it has passed
     */
    public long remainingMs() {
        return deadlineMs - processingMs();
    }

    private void notifyListeners(JobState from, JobState to) {
        for (JobStateListener listener : listeners) {
            listener.onTransition(this, from, to);
        }
    }
}
