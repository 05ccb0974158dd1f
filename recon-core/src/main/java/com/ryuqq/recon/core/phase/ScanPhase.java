package com.ryuqq.recon.core.phase;

/**
 * Scan 모듈 스케줄링 단계.
 *
 * <p>선언 순서가 곧 단계 순서입니다. 실제로 사용하는 단계 목록은 {@link PhaseSequence}로 구성합니다.</p>
 *
 * <pre>
 * INIT → DISCOVERY → ENUMERATION → ANALYSIS → CORRELATION → REPORTING → COMPLETE
 *   └──────────────────────── (any) ────────────────────────────────────► FAILED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ScanPhase {

    INIT,

    DISCOVERY,

    ENUMERATION,

    ANALYSIS,

    CORRELATION,

    REPORTING,

    /**
     * 정상 종료. 종료 단계.
     */
    COMPLETE,

    /**
     * 실패 종료. 어느 비종료 단계에서든 도달 가능한 종료 단계.
     */
    FAILED;

    /**
     * 종료 단계인지 확인.
     *
     * @return COMPLETE 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
