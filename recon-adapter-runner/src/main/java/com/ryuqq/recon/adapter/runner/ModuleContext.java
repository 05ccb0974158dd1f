package com.ryuqq.recon.adapter.runner;

import com.ryuqq.recon.core.model.ScanId;
import com.ryuqq.recon.core.phase.ScanPhase;

/**
 * 모듈 실행 시 전달되는 입력.
 *
 * @param scanId Scan ID
 * @param target 스캔 대상
 * @param moduleName 실행할 모듈 이름
 * @param phase 모듈이 배정된 단계
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ModuleContext(ScanId scanId, String target, String moduleName, ScanPhase phase) {
}
