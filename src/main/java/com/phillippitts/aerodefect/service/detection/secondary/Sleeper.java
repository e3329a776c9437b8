package com.phillippitts.aerodefect.service.detection.secondary;

import java.time.Duration;

/**
 * Backoff wait. Swapped for a recording no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
