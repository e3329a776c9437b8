package com.phillippitts.aerodefect.service.orchestration;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InspectionJobTest {

    @Test
    void walksHappyPath() {
        List<String> seen = new ArrayList<>();
        InspectionJob job = new InspectionJob("insp-7", 10_000,
                List.of((j, from, to) -> seen.add(from + "->" + to)));

        job.transitionTo(JobState.PREPROCESSING);
        job.transitionTo(JobState.DETECTING);
        job.transitionTo(JobState.AGGREGATING);
        job.transitionTo(JobState.COMPLETED);

        assertThat(job.getState()).isEqualTo(JobState.COMPLETED);
        assertThat(seen).containsExactly("QUEUED->PREPROCESSING", "PREPROCESSING->DETECTING",
                "DETECTING->AGGREGATING", "AGGREGATING->COMPLETED");
        assertThat(job.getInspectionId()).isEqualTo("insp-7");
        assertThat(job.getId()).isNotBlank();
    }

    @Test
    void skippingAStateIsIllegal() {
        InspectionJob job = new InspectionJob(null, 10_000, List.of());

        assertThatThrownBy(() -> job.transitionTo(JobState.DETECTING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("QUEUED -> DETECTING");
        assertThat(job.getState()).isEqualTo(JobState.QUEUED);
    }

    @Test
    void terminalStatesAreFinal() {
        InspectionJob job = new InspectionJob(null, 10_000, List.of());
        job.transitionTo(JobState.PREPROCESSING);

        assertThat(job.fail("bad image")).isTrue();
        assertThat(job.fail("again")).isFalse();
        assertThat(job.getFailureReason()).isEqualTo("bad image");
        assertThatThrownBy(() -> job.transitionTo(JobState.DETECTING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void anyNonTerminalStateCanFail() {
        for (JobState s : JobState.values()) {
            assertThat(s.canTransitionTo(JobState.FAILED)).isEqualTo(!s.isTerminal());
        }
        assertThat(JobState.COMPLETED.canTransitionTo(JobState.FAILED)).isFalse();
        assertThat(JobState.DETECTING.canTransitionTo(JobState.PREPROCESSING)).isFalse();
    }

    @Test
    void deadlineClockStartsOnAdmission() {
        InspectionJob job = new InspectionJob(null, 5_000, List.of());

        assertThat(job.processingMs()).isZero();
        assertThat(job.remainingMs()).isEqualTo(5_000);

        job.transitionTo(JobState.PREPROCESSING);

        assertThat(job.remainingMs()).isLessThanOrEqualTo(5_000).isGreaterThan(4_000);
    }
}
