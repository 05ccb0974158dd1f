package com.ryuqq.recon.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ModuleRunnerConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ModuleRunnerConfigTest {

    @Test
    void 기본값() {
        // when
        ModuleRunnerConfig config = new ModuleRunnerConfig();

        // then
        assertThat(config.concurrency()).isEqualTo(5);
        assertThat(config.pollingIntervalMs()).isEqualTo(50);
        assertThat(config.maxModuleTimeMs()).isEqualTo(300_000);
        assertThat(config.maxScanTimeMs()).isEqualTo(3_600_000);
    }

    @Test
    void withX는_해당_값만_변경함() {
        // when
        ModuleRunnerConfig config = new ModuleRunnerConfig().withConcurrency(2).withPollingIntervalMs(10);

        // then
        assertThat(config.concurrency()).isEqualTo(2);
        assertThat(config.pollingIntervalMs()).isEqualTo(10);
        assertThat(config.maxModuleTimeMs()).isEqualTo(300_000);
    }

    @Test
    void 유효하지_않은_값은_IllegalArgumentException() {
        assertThatThrownBy(() -> new ModuleRunnerConfig(0, 50, 1000, 1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> new ModuleRunnerConfig(1, 0, 1000, 1000))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ModuleRunnerConfig(1, 50, 0, 1000))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ModuleRunnerConfig(1, 50, 1000, 999))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxScanTimeMs");
    }
}
