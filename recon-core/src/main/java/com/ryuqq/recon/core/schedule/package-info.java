/**
 * Per-module scheduling records.
 *
 * <p>{@link com.ryuqq.recon.core.schedule.ModuleSchedule} values are immutable; every status
 * change yields a new value that the owning orchestrator swaps in under its lock.</p>
 *
 * <h2>Module Status Rules</h2>
 * <pre>
 * PENDING → RUNNING
 * PENDING | RUNNING → COMPLETED | FAILED
 *
 * Forbidden:
 * - COMPLETED / FAILED → * (terminal)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recon.core.schedule;
