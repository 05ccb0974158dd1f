package com.ryuqq.recon.core.orchestrator;

import com.ryuqq.recon.core.phase.ScanPhase;

/**
 * 단계 변경 관찰자.
 *
 * <p>{@code advancePhase()}, {@code complete()}, {@code fail()}로 단계가 바뀔 때
 * 락 해제 후 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PhaseChangeListener {

    void onPhaseChange(ScanPhase oldPhase, ScanPhase newPhase);
}
