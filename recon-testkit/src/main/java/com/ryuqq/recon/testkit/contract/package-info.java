/**
 * Contract test infrastructure for scan orchestration.
 *
 * <p>{@link com.ryuqq.recon.testkit.contract.AbstractScanContractTest} wires the in-memory
 * registry, journal and runner so that contract tests only describe scenarios.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.recon.testkit.contract;
