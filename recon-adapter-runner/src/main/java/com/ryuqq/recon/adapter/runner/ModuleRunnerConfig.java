package com.ryuqq.recon.adapter.runner;

/**
 * PhasedScanRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 실행할 모듈 수 (기본 5)</li>
 *   <li>pollingIntervalMs: 오케스트레이터 폴링 간격 (기본 50ms)</li>
 *   <li>maxModuleTimeMs: 모듈 하나의 최대 실행 시간 (기본 300000ms = 5분)</li>
 *   <li>maxScanTimeMs: 스캔 전체 최대 실행 시간 (기본 3600000ms = 1시간)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 동시 실행 모듈 수 (1 이상)
 * @param pollingIntervalMs 폴링 간격 (밀리초, 양수)
 * @param maxModuleTimeMs 모듈 최대 실행 시간 (밀리초, 양수)
 * @param maxScanTimeMs 스캔 최대 실행 시간 (밀리초, maxModuleTimeMs 이상)
 */
public record ModuleRunnerConfig(
    int concurrency,
    long pollingIntervalMs,
    long maxModuleTimeMs,
    long maxScanTimeMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=5, pollingIntervalMs=50ms, maxModuleTimeMs=300000ms, maxScanTimeMs=3600000ms</p>
     */
    public ModuleRunnerConfig() {
        this(5, 50, 300_000, 3_600_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ModuleRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (maxModuleTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxModuleTimeMs must be positive (current: " + maxModuleTimeMs + ")"
            );
        }
        if (maxScanTimeMs < maxModuleTimeMs) {
            throw new IllegalArgumentException(
                "maxScanTimeMs must be greater than or equal to maxModuleTimeMs (scan: " + maxScanTimeMs
                    + ", module: " + maxModuleTimeMs + ")"
            );
        }
    }

    public ModuleRunnerConfig withConcurrency(int concurrency) {
        return new ModuleRunnerConfig(concurrency, pollingIntervalMs, maxModuleTimeMs, maxScanTimeMs);
    }

    public ModuleRunnerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new ModuleRunnerConfig(concurrency, pollingIntervalMs, maxModuleTimeMs, maxScanTimeMs);
    }

    public ModuleRunnerConfig withMaxModuleTimeMs(long maxModuleTimeMs) {
        return new ModuleRunnerConfig(concurrency, pollingIntervalMs, maxModuleTimeMs, maxScanTimeMs);
    }

    public ModuleRunnerConfig withMaxScanTimeMs(long maxScanTimeMs) {
        return new ModuleRunnerConfig(concurrency, pollingIntervalMs, maxModuleTimeMs, maxScanTimeMs);
    }
}
