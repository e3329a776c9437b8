package com.phillippitts.aerodefect.config.properties;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnsembleConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfig.class);

    @Test
    void defaultsAreValid() {
        EnsembleConfig config = EnsembleConfig.defaults();

        assertThat(config.primaryWeight() + config.secondaryWeight()).isEqualTo(1.0);
        assertThat(config.matchIouThreshold()).isEqualTo(0.5);
        assertThat(config.nmsIouThreshold()).isEqualTo(0.4);
    }

    @Test
    void weightsNotSummingToOneAreRejected() {
        assertThatThrownBy(() -> new EnsembleConfig(0.6, 0.6, 0.5, 0.4, 0.7, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 1.0");
    }

    @Test
    void weightsAreNotSilentlyNormalized() {
        assertThatThrownBy(() -> new EnsembleConfig(3.0, 2.0, 0.5, 0.4, 0.7, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sumWithinToleranceIsAccepted() {
        EnsembleConfig config = new EnsembleConfig(0.7, 0.3 + 1e-9, 0.5, 0.4, 0.7, 0.5);

        assertThat(config.primaryWeight()).isEqualTo(0.7);
    }

    @Test
    void thresholdsOutsideUnitIntervalAreRejected() {
        assertThatThrownBy(() -> new EnsembleConfig(0.6, 0.4, 1.5, 0.4, 0.7, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("match-iou-threshold");
    }

    @Test
    void bindsFromProperties() {
        runner.withPropertyValues("ensemble.primary-weight=0.7", "ensemble.secondary-weight=0.3")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    EnsembleConfig config = context.getBean(EnsembleConfig.class);
                    assertThat(config.primaryWeight()).isEqualTo(0.7);
                    assertThat(config.minFinalConfidence()).isEqualTo(0.5);
                });
    }

    @Test
    void invalidWeightsFailStartup() {
        runner.withPropertyValues("ensemble.primary-weight=0.5", "ensemble.secondary-weight=0.4")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(EnsembleConfig.class)
    static class TestConfig {
    }
}
