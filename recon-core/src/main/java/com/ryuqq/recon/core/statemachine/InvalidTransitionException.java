package com.ryuqq.recon.core.statemachine;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 허용되지 않은 Scan 상태 전이 시도.
 *
 * <p>이 예외가 발생한 경우 상태 머신의 상태와 이력은 변경되지 않습니다.
 * 호출자는 {@link #getAllowed()}로 현재 상태에서 가능한 전이를 진단 메시지에 포함할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends IllegalStateException {

    private final ScanState from;
    private final ScanState to;
    private final Set<ScanState> allowed;

    /**
     * 생성자.
     *
     * @param from 현재 상태
     * @param to 요청된 상태
     * @param allowed 현재 상태에서 허용된 상태 집합
     */
    public InvalidTransitionException(ScanState from, ScanState to, Set<ScanState> allowed) {
        super(buildMessage(from, to, allowed));
        this.from = from;
        this.to = to;
        this.allowed = allowed.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(allowed));
    }

    /**
     * 현재 상태에서 허용된 전이 집합으로 생성.
     *
     * @param from 현재 상태
     * @param to 요청된 상태
     */
    public InvalidTransitionException(ScanState from, ScanState to) {
        this(from, to, TransitionTable.allowedTargets(from));
    }

    private static String buildMessage(ScanState from, ScanState to, Set<ScanState> allowed) {
        if (from != null && from.isTerminal()) {
            return String.format("Cannot transition from terminal state: %s → %s (Allowed: %s)", from, to, allowed);
        }
        return String.format("Invalid scan state transition: %s → %s (Allowed: %s)", from, to, allowed);
    }

    public ScanState getFrom() {
        return from;
    }

    public ScanState getTo() {
        return to;
    }

    public Set<ScanState> getAllowed() {
        return allowed;
    }
}
