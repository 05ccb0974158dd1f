package com.ryuqq.recon.adapter.inmemory.registry;

import com.ryuqq.recon.core.model.ScanId;
import com.ryuqq.recon.core.orchestrator.ScanOrchestrator;
import com.ryuqq.recon.core.statemachine.ScanStateMachine;

/**
 * A scan held by {@link InMemoryScanRegistry}: its lifecycle machine and its module orchestrator.
 *
 * @param scanId scan id
 * @param target scan target
 * @param stateMachine lifecycle state machine
 * @param orchestrator module orchestrator
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RegisteredScan(
    ScanId scanId,
    String target,
    ScanStateMachine stateMachine,
    ScanOrchestrator orchestrator
) {

    public RegisteredScan {
        if (scanId == null) {
            throw new IllegalArgumentException("scanId cannot be null");
        }
        if (stateMachine == null) {
            throw new IllegalArgumentException("stateMachine cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
    }
}
