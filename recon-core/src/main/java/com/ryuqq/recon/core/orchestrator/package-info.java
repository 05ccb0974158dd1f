/**
 * Phase-based module scheduling for a single scan.
 *
 * <p>{@link com.ryuqq.recon.core.orchestrator.ScanOrchestrator} owns the phase cursor and the
 * module registry. It never runs modules itself: an external executor polls
 * {@code getRunnableModules}, runs the modules and reports back through
 * {@code moduleStarted}, {@code moduleCompleted} and {@code moduleFailed}.</p>
 *
 * <p>Configuration lives in {@link com.ryuqq.recon.core.orchestrator.OrchestratorConfig}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recon.core.orchestrator;
