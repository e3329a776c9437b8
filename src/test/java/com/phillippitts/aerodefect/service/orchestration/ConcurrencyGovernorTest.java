package com.phillippitts.aerodefect.service.orchestration;

import com.phillippitts.aerodefect.config.properties.InspectionProperties;
import com.phillippitts.aerodefect.exception.AeroDefectException;
import com.phillippitts.aerodefect.exception.CapacityExceededException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ConcurrencyGovernorTest {

    private final ExecutorService callers = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        Thread.interrupted();
    }

    @Test
    void sixthSubmissionWaitsForAFreeSlot() {
        ConcurrencyGovernor governor = new ConcurrencyGovernor(new InspectionProperties(5, 10_000, 30_000, 0));
        Semaphore gate = new Semaphore(0);
        AtomicInteger started = new AtomicInteger();
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();

        for (int i = 0; i < 6; i++) {
            callers.submit(() -> governor.execute(() -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                started.incrementAndGet();
                gate.acquireUninterruptibly();
                active.decrementAndGet();
                return null;
            }));
        }

        await().atMost(5, SECONDS).until(() -> started.get() == 5 && governor.queuedSubmissions() == 1);
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> started.get() == 5);
        assertThat(governor.availableSlots()).isZero();

        gate.release(1);
        await().atMost(5, SECONDS).until(() -> started.get() == 6);

        gate.release(5);
        await().atMost(5, SECONDS).until(() -> governor.availableSlots() == 5);
        assertThat(maxActive.get()).isEqualTo(5);
    }

    @Test
    void queueTimeoutRaisesCapacityExceeded() throws Exception {
        ConcurrencyGovernor governor = new ConcurrencyGovernor(new InspectionProperties(1, 10_000, 30_000, 100));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        callers.submit(() -> governor.execute(() -> {
            holding.countDown();
            awaitQuietly(release);
            return null;
        }));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> governor.execute(() -> "never"))
                .isInstanceOf(CapacityExceededException.class)
                .hasMessageContaining("limit 1");

        release.countDown();
        await().atMost(5, SECONDS).until(() -> governor.availableSlots() == 1);
    }

    @Test
    void slotIsReleasedWhenWorkThrows() {
        ConcurrencyGovernor governor = new ConcurrencyGovernor(new InspectionProperties(2, 10_000, 30_000, 0));

        assertThatThrownBy(() -> governor.execute(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(governor.availableSlots()).isEqualTo(2);
        assertThat(governor.execute(() -> "ok")).isEqualTo("ok");
    }

    @Test
    void interruptedCallerIsRejected() {
        ConcurrencyGovernor governor = new ConcurrencyGovernor(InspectionProperties.defaults());
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> governor.execute(() -> "never"))
                .isInstanceOf(AeroDefectException.class)
                .hasMessageContaining("Interrupted");
        assertThat(Thread.interrupted()).isTrue();
        assertThat(governor.availableSlots()).isEqualTo(5);
    }

    @Test
    void exposesSlotGauges() {
        ConcurrencyGovernor governor = new ConcurrencyGovernor(InspectionProperties.defaults());
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        governor.bindTo(registry);

        assertThat(registry.get("aerodefect.governor.available").gauge().value()).isEqualTo(5.0);
        assertThat(registry.get("aerodefect.governor.queued").gauge().value()).isZero();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
