/**
 * Scan identity value objects.
 *
 * <p>{@link com.ryuqq.recon.core.model.ScanId} is the only key shared by the
 * state machine and the orchestrator of a scan.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recon.core.model;
