package com.ryuqq.recon.core.orchestrator;

/**
 * 이미 등록된 이름으로 모듈을 다시 등록할 때의 처리 정책.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RegistrationPolicy {

    /**
     * 기존 스케줄을 새 설정으로 덮어씀 (PENDING으로 초기화).
     *
     * <p>등록 순서는 최초 등록 시점을 유지합니다.</p>
     */
    OVERWRITE,

    /**
     * 재등록을 거부하고 {@link DuplicateModuleException}을 던짐.
     */
    REJECT
}
