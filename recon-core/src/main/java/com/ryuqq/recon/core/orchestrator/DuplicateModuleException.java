package com.ryuqq.recon.core.orchestrator;

/**
 * {@link RegistrationPolicy#REJECT} 정책에서 같은 이름의 모듈을 다시 등록한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DuplicateModuleException extends IllegalStateException {

    private final String moduleName;

    public DuplicateModuleException(String moduleName) {
        super("Module already registered: " + moduleName);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
