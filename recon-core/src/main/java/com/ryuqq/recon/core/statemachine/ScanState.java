package com.ryuqq.recon.core.statemachine;

/**
 * Scan의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED ──► QUEUED ──► STARTING ──► RUNNING ──► COMPLETED
 *    │           │           │          │  ▲  │
 *    │           │           │          ▼  │  ├─► FAILED
 *    │           │           │        PAUSED  │
 *    │           │           │          │     ▼
 *    │           │           │          └──► STOPPING ──► COMPLETED / FAILED / CANCELLED
 *    ▼           ▼           ▼
 * CANCELLED   CANCELLED   FAILED / CANCELLED
 * </pre>
 *
 * <p>허용 전이 전체 목록은 {@link TransitionTable}을 참고하세요.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ScanState {

    /**
     * 생성됨 (아직 큐에 들어가지 않음).
     */
    CREATED,

    /**
     * 실행 대기열에 등록됨.
     */
    QUEUED,

    /**
     * 실행 준비 중 (모듈 로딩 등).
     */
    STARTING,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 일시 정지.
     */
    PAUSED,

    /**
     * 중단 요청됨 (실행 중인 모듈 정리 대기).
     */
    STOPPING,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return COMPLETED, FAILED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 활성 상태인지 확인.
     *
     * @return STARTING 또는 RUNNING인 경우 true
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}
