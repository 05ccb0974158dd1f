package com.ryuqq.recon.core.phase;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 한 단계를 떠날 때 기록되는 요약.
 *
 * @param phase 떠난 단계
 * @param modulesCompleted 해당 단계가 현재 단계였던 동안 완료된 모듈 수
 * @param modulesFailed 해당 단계가 현재 단계였던 동안 실패한 모듈 수
 * @param completedAt 단계를 떠난 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PhaseResult(
    ScanPhase phase,
    int modulesCompleted,
    int modulesFailed,
    Instant completedAt
) {

    public PhaseResult {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (completedAt == null) {
            throw new IllegalArgumentException("completedAt cannot be null");
        }
        if (modulesCompleted < 0 || modulesFailed < 0) {
            throw new IllegalArgumentException(
                "module counts cannot be negative (completed: " + modulesCompleted + ", failed: " + modulesFailed + ")"
            );
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("phase", phase.name());
        map.put("modules_completed", modulesCompleted);
        map.put("modules_failed", modulesFailed);
        map.put("completed_at", completedAt.toEpochMilli());
        return map;
    }
}
