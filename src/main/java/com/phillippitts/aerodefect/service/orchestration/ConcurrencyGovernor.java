package com.phillippitts.aerodefect.service.orchestration;

import com.phillippitts.aerodefect.config.properties.InspectionProperties;
import com.phillippitts.aerodefect.exception.AeroDefectException;
import com.phillippitts.aerodefect.exception.CapacityExceededException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * System-wide admission control for inspection jobs.
 *
 * <p>One fair {@link Semaphore} sized {@code inspection.max-concurrent-jobs}: excess submissions
 * wait in arrival order. With {@code inspection.queue-timeout-ms=0} they wait indefinitely; otherwise
 * a submission that cannot get a slot in time fails with {@link CapacityExceededException}.
 * The slot is released when the work returns or throws.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EnsembleResult result = governor.execute(() -> coordinator.run(job, imageBytes));
 * }</pre>
 */
@Component
public class ConcurrencyGovernor implements MeterBinder {

    private static final Logger LOG = LogManager.getLogger(ConcurrencyGovernor.class);

    private final Semaphore slots;
    private final int maxConcurrentJobs;
    private final long queueTimeoutMs;

    public ConcurrencyGovernor(InspectionProperties properties) {
        this.maxConcurrentJobs = properties.maxConcurrentJobs();
        this.queueTimeoutMs = properties.queueTimeoutMs();
        this.slots = new Semaphore(maxConcurrentJobs, true);
    }

    /**
     * Runs {@code work} once a slot is free.
     *
     * @throws CapacityExceededException if the queue timeout elapses first
     * @throws AeroDefectException       if the caller is interrupted while queued
     */
    public <T> T execute(Supplier<T> work) {
        acquire();
        try {
            return work.get();
        } finally {
            slots.release();
        }
    }

    private void acquire() {
        long start = System.nanoTime();
        try {
            // timed form with zero wait honours fairness; the untimed tryAcquire() would barge
            if (slots.tryAcquire(0, TimeUnit.MILLISECONDS)) {
                return;
            }
            LOG.debug("All {} inspection slots busy; queueing (queued={})", maxConcurrentJobs,
                    slots.getQueueLength() + 1);
            if (queueTimeoutMs <= 0) {
                slots.acquire();
            } else if (!slots.tryAcquire(queueTimeoutMs, TimeUnit.MILLISECONDS)) {
                long waited = (System.nanoTime() - start) / 1_000_000L;
                LOG.warn("No inspection slot free after {} ms", waited);
                throw new CapacityExceededException(maxConcurrentJobs, waited);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AeroDefectException("Interrupted while waiting for an inspection slot", e);
        }
        LOG.debug("Inspection slot acquired after {} ms", (System.nanoTime() - start) / 1_000_000L);
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int queuedSubmissions() {
        return slots.getQueueLength();
    }

    public int maxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("aerodefect.governor.available", slots, Semaphore::availablePermits)
                .description("Free inspection slots")
                .register(registry);
        Gauge.builder("aerodefect.governor.queued", slots, Semaphore::getQueueLength)
                .description("Submissions waiting for an inspection slot")
                .register(registry);
    }
}
