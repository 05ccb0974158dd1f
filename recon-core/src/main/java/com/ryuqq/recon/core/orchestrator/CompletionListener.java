package com.ryuqq.recon.core.orchestrator;

/**
 * 오케스트레이터 종료 관찰자.
 *
 * <p>COMPLETE 또는 FAILED 도달 시 정확히 한 번 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CompletionListener {

    void onCompletion(ScanOrchestrator orchestrator);
}
