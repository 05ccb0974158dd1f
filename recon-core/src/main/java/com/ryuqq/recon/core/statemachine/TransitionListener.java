package com.ryuqq.recon.core.statemachine;

import com.ryuqq.recon.core.model.ScanId;

/**
 * Scan 상태 전이 관찰자.
 *
 * <p>전이가 커밋되고 내부 락이 해제된 뒤 호출됩니다.
 * 리스너에서 발생한 예외는 로그로만 남고 전이 결과에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionListener {

    /**
     * 상태 전이 통지.
     *
     * @param oldState 이전 상태
     * @param newState 새 상태
     * @param scanId 전이가 발생한 Scan
     */
    void onTransition(ScanState oldState, ScanState newState, ScanId scanId);
}
