package com.ryuqq.recon.core.orchestrator;

import com.ryuqq.recon.core.phase.PhaseSequence;

/**
 * ScanOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>phaseSequence: 거쳐 갈 단계 목록 (기본 {@link PhaseSequence#defaults()})</li>
 *   <li>registrationPolicy: 중복 등록 처리 정책 (기본 OVERWRITE)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param phaseSequence 단계 목록
 * @param registrationPolicy 중복 등록 정책
 */
public record OrchestratorConfig(PhaseSequence phaseSequence, RegistrationPolicy registrationPolicy) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: phaseSequence=INIT ~ COMPLETE 전체, registrationPolicy=OVERWRITE</p>
     */
    public OrchestratorConfig() {
        this(PhaseSequence.defaults(), RegistrationPolicy.OVERWRITE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public OrchestratorConfig {
        if (phaseSequence == null) {
            throw new IllegalArgumentException("phaseSequence cannot be null");
        }
        if (registrationPolicy == null) {
            throw new IllegalArgumentException("registrationPolicy cannot be null");
        }
    }

    /**
     * phaseSequence만 변경한 새 인스턴스 생성.
     *
     * @param phaseSequence 새 단계 목록
     * @return 새 OrchestratorConfig 인스턴스
     */
    public OrchestratorConfig withPhaseSequence(PhaseSequence phaseSequence) {
        return new OrchestratorConfig(phaseSequence, this.registrationPolicy);
    }

    /**
     * registrationPolicy만 변경한 새 인스턴스 생성.
     *
     * @param registrationPolicy 새 정책
     * @return 새 OrchestratorConfig 인스턴스
     */
    public OrchestratorConfig withRegistrationPolicy(RegistrationPolicy registrationPolicy) {
        return new OrchestratorConfig(this.phaseSequence, registrationPolicy);
    }
}
