/**
 * In-memory scan registry.
 *
 * <p>{@link com.ryuqq.recon.adapter.inmemory.registry.InMemoryScanRegistry} owns one
 * state machine and one orchestrator per scan and handles create, restore, stop and delete
 * requests. {@link com.ryuqq.recon.adapter.inmemory.registry.ScanStatusMapper} translates
 * between {@link com.ryuqq.recon.core.statemachine.ScanState} and the legacy status strings.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.recon.adapter.inmemory.registry;
