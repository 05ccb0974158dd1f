package com.ryuqq.recon.core.schedule;

/**
 * Scan 안에서 모듈 하나의 실행 상태.
 *
 * <pre>
 * PENDING ──► RUNNING ──► COMPLETED
 *    │           └──────► FAILED
 *    └──► COMPLETED / FAILED (시작 보고 없이 결과만 보고된 경우)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ModuleStatus {

    PENDING("pending"),

    RUNNING("running"),

    COMPLETED("completed"),

    FAILED("failed");

    /**
     * 등록되지 않은 모듈에 대한 상태 조회 결과.
     */
    public static final String UNKNOWN = "unknown";

    private final String value;

    ModuleStatus(String value) {
        this.value = value;
    }

    /**
     * 직렬화 값 (소문자).
     *
     * @return pending, running, completed, failed 중 하나
     */
    public String value() {
        return value;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
