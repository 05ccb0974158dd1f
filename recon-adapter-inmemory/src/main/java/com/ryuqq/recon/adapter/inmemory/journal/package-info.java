/**
 * Bounded in-memory journal of scan lifecycle facts (creation, state transitions, phase changes, deletion).
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recon.adapter.inmemory.journal;
