package com.ryuqq.recon.core.statemachine;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 성공한 상태 전이 1건의 기록.
 *
 * <p>전이가 성공할 때마다 정확히 한 번 생성되어 {@link ScanStateMachine}의 이력에 추가됩니다.</p>
 *
 * @param fromState 이전 상태
 * @param toState 새 상태
 * @param timestamp 전이 시각
 * @param reason 전이 사유 (빈 문자열 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StateTransition(
    ScanState fromState,
    ScanState toState,
    Instant timestamp,
    String reason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 상태 또는 timestamp가 null인 경우
     */
    public StateTransition {
        if (fromState == null || toState == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + fromState + ", to: " + toState + ")");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        reason = reason == null ? "" : reason;
    }

    /**
     * 직렬화용 Map 변환.
     *
     * @return from, to, timestamp(epoch millis), reason 키를 가진 Map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("from", fromState.name());
        map.put("to", toState.name());
        map.put("timestamp", timestamp.toEpochMilli());
        map.put("reason", reason);
        return map;
    }
}
