package com.ryuqq.recon.adapter.runner;

/**
 * 모듈 하나의 실행 로직.
 *
 * <p>워커 스레드에서 호출됩니다. 정상 반환은 완료, 예외는 실패로 보고됩니다.
 * 타임아웃 시 실행 스레드가 인터럽트되므로 장시간 실행되는 구현은 인터럽트에 응답해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ModuleTask {

    /**
     * 모듈 실행.
     *
     * @param context 실행 입력
     * @return 생성한 이벤트 수 (0 이상)
     * @throws Exception 실행 실패 시
     */
    long execute(ModuleContext context) throws Exception;
}
