package com.phillippitts.aerodefect.service.orchestration;

import com.phillippitts.aerodefect.domain.DetectionSet;
import com.phillippitts.aerodefect.service.preprocessing.PreprocessedImage;

import java.util.Objects;

/**
 * Runs both detectors on one image concurrently and joins them under a deadline.
 *
 * <p>The local model sees the normalized image, the remote model the original one.
 */
public interface ParallelDetectionService {

    /**
     * Never throws for detector problems: a failed or abandoned branch comes back as a failed
     * {@link DetectionSet}.
     *
     * @param image     preprocessing output holding both renditions of the upload
     * @param timeoutMs how long to wait for both branches
     * @return both branch results, never null
     */
    DetectionPair detectBoth(PreprocessedImage image, long timeoutMs);

    /**
     * Outputs of the two branches for one job.
     */
    record DetectionPair(DetectionSet primary, DetectionSet secondary) {

        public DetectionPair {
            Objects.requireNonNull(primary, "primary");
            Objects.requireNonNull(secondary, "secondary");
        }

        public boolean bothFailed() {
            return primary.isFailed() && secondary.isFailed();
        }

        public boolean anyFailed() {
            return primary.isFailed() || secondary.isFailed();
        }
    }
}
