package com.ryuqq.recon.core.statemachine;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Scan 상태 전이표.
 *
 * <p>이 클래스는 {@link ScanState} 간 허용된 전이를 정의하고,
 * 전이 요청이 규칙을 따르는지 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → QUEUED, CANCELLED</li>
 *   <li>QUEUED → STARTING, CANCELLED</li>
 *   <li>STARTING → RUNNING, FAILED, CANCELLED</li>
 *   <li>RUNNING → PAUSED, STOPPING, COMPLETED, FAILED</li>
 *   <li>PAUSED → RUNNING, STOPPING, CANCELLED</li>
 *   <li>STOPPING → COMPLETED, FAILED, CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(COMPLETED, FAILED, CANCELLED)의 허용 집합은 비어 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransitionTable {

    // Utility class - prevent instantiation
    private TransitionTable() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 주어진 상태에서 전이 가능한 상태 집합 조회.
     *
     * @param from 현재 상태
     * @return 허용된 다음 상태 집합 (수정 불가)
     * @throws IllegalArgumentException from이 null인 경우
     */
    public static Set<ScanState> allowedTargets(ScanState from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        EnumSet<ScanState> allowed = switch (from) {
            case CREATED -> EnumSet.of(ScanState.QUEUED, ScanState.CANCELLED);
            case QUEUED -> EnumSet.of(ScanState.STARTING, ScanState.CANCELLED);
            case STARTING -> EnumSet.of(ScanState.RUNNING, ScanState.FAILED, ScanState.CANCELLED);
            case RUNNING -> EnumSet.of(ScanState.PAUSED, ScanState.STOPPING, ScanState.COMPLETED, ScanState.FAILED);
            case PAUSED -> EnumSet.of(ScanState.RUNNING, ScanState.STOPPING, ScanState.CANCELLED);
            case STOPPING -> EnumSet.of(ScanState.COMPLETED, ScanState.FAILED, ScanState.CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(ScanState.class);
        };
        return Collections.unmodifiableSet(allowed);
    }

    /**
     * 전이 허용 여부 확인 (부수 효과 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(ScanState from, ScanState to) {
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        return allowedTargets(from).contains(to);
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidTransitionException 허용되지 않은 전이인 경우
     */
    public static void validate(ScanState from, ScanState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        Set<ScanState> allowed = allowedTargets(from);
        if (!allowed.contains(to)) {
            throw new InvalidTransitionException(from, to, allowed);
        }
    }
}
