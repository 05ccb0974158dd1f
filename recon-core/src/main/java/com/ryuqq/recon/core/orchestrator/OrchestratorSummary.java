package com.ryuqq.recon.core.orchestrator;

import com.ryuqq.recon.core.model.ScanId;
import com.ryuqq.recon.core.phase.ScanPhase;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 상태 API용 오케스트레이터 요약.
 *
 * @param scanId Scan ID
 * @param target 스캔 대상
 * @param currentPhase 현재 단계
 * @param totalModules 등록된 모듈 수
 * @param pendingModules PENDING 모듈 수
 * @param runningModules RUNNING 모듈 수
 * @param completedModules COMPLETED 모듈 수
 * @param failedModules FAILED 모듈 수
 * @param totalEvents 누적 이벤트 수
 * @param totalErrors 누적 오류 수
 * @param elapsedSeconds start() 이후 경과 시간 (초, 시작 전이면 0)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorSummary(
    ScanId scanId,
    String target,
    ScanPhase currentPhase,
    int totalModules,
    int pendingModules,
    int runningModules,
    int completedModules,
    int failedModules,
    long totalEvents,
    long totalErrors,
    double elapsedSeconds
) {

    public Map<String, Object> toMap() {
        Map<String, Object> modules = new LinkedHashMap<>();
        modules.put("total", totalModules);
        modules.put("pending", pendingModules);
        modules.put("running", runningModules);
        modules.put("completed", completedModules);
        modules.put("failed", failedModules);

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("scan_id", scanId.getValue());
        map.put("target", target);
        map.put("phase", currentPhase.name());
        map.put("modules", modules);
        map.put("total_events", totalEvents);
        map.put("total_errors", totalErrors);
        map.put("elapsed_seconds", elapsedSeconds);
        return map;
    }
}
