/**
 * Scan lifecycle state machine package.
 *
 * <p>This package governs which high-level states a scan may move through,
 * ensuring that a failed transition never mutates the machine.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.recon.core.statemachine.ScanState} - Scan lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.recon.core.statemachine.TransitionTable} - Allowed transitions and validation</li>
 *   <li>{@link com.ryuqq.recon.core.statemachine.ScanStateMachine} - Thread-safe per-scan machine with history and observers</li>
 *   <li>{@link com.ryuqq.recon.core.statemachine.StateTransition} - Immutable history record</li>
 *   <li>{@link com.ryuqq.recon.core.statemachine.InvalidTransitionException} - Rejected transition (from, to, allowed)</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * CREATED  → QUEUED, CANCELLED
 * QUEUED   → STARTING, CANCELLED
 * STARTING → RUNNING, FAILED, CANCELLED
 * RUNNING  → PAUSED, STOPPING, COMPLETED, FAILED
 * PAUSED   → RUNNING, STOPPING, CANCELLED
 * STOPPING → COMPLETED, FAILED, CANCELLED
 *
 * Forbidden:
 * - COMPLETED / FAILED / CANCELLED → * (terminal states)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ScanStateMachine machine = new ScanStateMachine(ScanId.of("scan-001"));
 * machine.transition(ScanState.QUEUED);
 * machine.transition(ScanState.STARTING);
 * machine.transition(ScanState.RUNNING);
 * machine.transition(ScanState.COMPLETED, "All modules done");
 *
 * // This will throw InvalidTransitionException
 * machine.transition(ScanState.RUNNING);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recon.core.statemachine;
