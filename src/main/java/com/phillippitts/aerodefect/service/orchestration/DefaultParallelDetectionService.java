package com.phillippitts.aerodefect.service.orchestration;

import com.phillippitts.aerodefect.domain.DetectionSet;
import com.phillippitts.aerodefect.exception.DetectionTimeoutException;
import com.phillippitts.aerodefect.service.detection.primary.PrimaryDetectorAdapter;
import com.phillippitts.aerodefect.service.detection.secondary.SecondaryDetectorAdapter;
import com.phillippitts.aerodefect.service.preprocessing.PreprocessedImage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default implementation of {@link ParallelDetectionService}.
 *
 * <p>The local branch runs on {@code detectorExecutor} against the normalized image; the remote
 * branch runs on its own {@code remoteDetectorExecutor} against the original image, so a hung
 * endpoint can only exhaust the remote pool. Both futures are awaited against one deadline. A branch
 * still running at the deadline is cancelled with interruption, which aborts an in-flight HTTP call or
 * backoff sleep, and is reported as a {@link DetectionTimeoutException} failure.
 *
 * <p>The remote branch also receives the deadline as its retry budget.
 */
@Service
public class DefaultParallelDetectionService implements ParallelDetectionService {

    private static final Logger LOG = LogManager.getLogger(DefaultParallelDetectionService.class);

    /**
     * One detector as seen by the orchestrator.
     */
    @FunctionalInterface
    interface DetectorBranch {

        DetectionSet detect(BufferedImage image, long budgetMs);
    }

    private final DetectorBranch primary;
    private final DetectorBranch secondary;
    private final AsyncTaskExecutor primaryExecutor;
    private final AsyncTaskExecutor secondaryExecutor;

    @Autowired
    public DefaultParallelDetectionService(PrimaryDetectorAdapter primaryAdapter,
                                           SecondaryDetectorAdapter secondaryAdapter,
                                           @Qualifier("detectorExecutor") AsyncTaskExecutor primaryExecutor,
                                           @Qualifier("remoteDetectorExecutor") AsyncTaskExecutor secondaryExecutor) {
        this((image, budgetMs) -> primaryAdapter.detect(image),
                (image, budgetMs) -> secondaryAdapter.detect(image, List.of(), Duration.ofMillis(budgetMs)),
                primaryExecutor, secondaryExecutor);
    }

    DefaultParallelDetectionService(DetectorBranch primary, DetectorBranch secondary,
                                    AsyncTaskExecutor primaryExecutor, AsyncTaskExecutor secondaryExecutor) {
        this.primary = Objects.requireNonNull(primary);
        this.secondary = Objects.requireNonNull(secondary);
        this.primaryExecutor = Objects.requireNonNull(primaryExecutor);
        this.secondaryExecutor = Objects.requireNonNull(secondaryExecutor);
    }

    @Override
    public DetectionPair detectBoth(PreprocessedImage image, long timeoutMs) {
        Objects.requireNonNull(image, "image");
        long waitMs = Math.max(1L, timeoutMs);
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitMs);

        Future<DetectionSet> primaryFuture = submit(PrimaryDetectorAdapter.DETECTOR_NAME, primaryExecutor,
                () -> runBranch(PrimaryDetectorAdapter.DETECTOR_NAME, primary, image.normalized(), waitMs));
        Future<DetectionSet> secondaryFuture = submit(SecondaryDetectorAdapter.DETECTOR_NAME, secondaryExecutor,
                () -> runBranch(SecondaryDetectorAdapter.DETECTOR_NAME, secondary, image.original(), waitMs));

        DetectionSet p = await(PrimaryDetectorAdapter.DETECTOR_NAME, primaryFuture, deadlineNanos, waitMs);
        DetectionSet s = await(SecondaryDetectorAdapter.DETECTOR_NAME, secondaryFuture, deadlineNanos, waitMs);
        return new DetectionPair(p, s);
    }

    private static Future<DetectionSet> submit(String name, AsyncTaskExecutor executor, Callable<DetectionSet> task) {
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            LOG.warn("{} detector branch rejected: {}", name, e.getMessage());
            return CompletableFuture.completedFuture(
                    DetectionSet.failure(name + " detector unavailable: executor saturated", 0));
        }
    }

    private static DetectionSet runBranch(String name, DetectorBranch branch, BufferedImage image, long budgetMs) {
        long t0 = System.nanoTime();
        try {
            DetectionSet result = branch.detect(image, budgetMs);
            if (result == null) {
                return DetectionSet.failure(name + " detector returned no result", elapsedMs(t0));
            }
            return result;
        } catch (RuntimeException e) {
            LOG.error("{} detector threw unexpectedly", name, e);
            return DetectionSet.failure(name + " detector error: " + e.getMessage(), elapsedMs(t0));
        }
    }

    private static DetectionSet await(String name, Future<DetectionSet> future, long deadlineNanos, long waitMs) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | CancellationException e) {
            future.cancel(true);
            DetectionTimeoutException timeout = new DetectionTimeoutException(name, waitMs);
            LOG.warn(timeout.getMessage());
            return DetectionSet.failure(timeout.getMessage(), waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Interrupted while waiting for {} detector; abandoning it", name);
            return DetectionSet.failure(name + " detector abandoned: caller interrupted", waitMs);
        } catch (ExecutionException e) {
            // runBranch only lets Errors through
            LOG.error("{} detector branch failed", name, e.getCause());
            return DetectionSet.failure(name + " detector error: " + e.getCause(), waitMs);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
