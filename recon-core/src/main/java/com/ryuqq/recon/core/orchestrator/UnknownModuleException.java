package com.ryuqq.recon.core.orchestrator;

/**
 * 등록되지 않은 모듈에 대한 상태 변경 요청.
 *
 * <p>조회 연산({@code getModuleStatus}, {@code canRunModule})은 이 예외 대신
 * 센티널 값을 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnknownModuleException extends IllegalArgumentException {

    private final String moduleName;

    public UnknownModuleException(String moduleName) {
        super("Module not registered: " + moduleName);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
