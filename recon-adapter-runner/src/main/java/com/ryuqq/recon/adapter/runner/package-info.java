/**
 * Runner Adapter Layer - 스캔 실행기.
 *
 * <p>core의 {@link com.ryuqq.recon.core.orchestrator.ScanOrchestrator}는 스레드를 만들지 않는
 * 수동 자료구조이므로, 실제로 모듈을 실행하는 쪽은 이 패키지의 실행기입니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.recon.adapter.runner.PhasedScanRunner} - 단계별 디스패치 + 상태 머신 구동</li>
 *   <li>{@link com.ryuqq.recon.adapter.runner.ModuleTask} - 모듈 실행 로직 (함수형 인터페이스)</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PhasedScanRunner, fixed thread pool)
 *   ↓ polls / reports
 * core/orchestrator (ScanOrchestrator)
 *   ↓ drives
 * core/statemachine (ScanStateMachine)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.recon.adapter.runner;
