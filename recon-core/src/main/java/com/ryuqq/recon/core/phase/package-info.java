/**
 * Scan phase model.
 *
 * <p>{@link com.ryuqq.recon.core.phase.ScanPhase} is the closed, ordered set of phases;
 * {@link com.ryuqq.recon.core.phase.PhaseSequence} selects which of them one orchestrator
 * walks through; {@link com.ryuqq.recon.core.phase.PhaseResult} is recorded each time a
 * phase is left.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recon.core.phase;
