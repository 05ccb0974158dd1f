package com.ryuqq.recon.adapter.inmemory.registry;

import com.ryuqq.recon.core.statemachine.ScanState;

import java.util.Locale;

/**
 * Maps {@link ScanState} to and from the legacy status strings stored in the scan table.
 *
 * <p><strong>Mapping:</strong></p>
 * <pre>
 * ScanState     legacy status
 * ---------     ---------------
 * STOPPING  ⇄  ABORT-REQUESTED
 * COMPLETED ⇄  FINISHED
 * FAILED    ⇄  ERROR-FAILED
 * CANCELLED ⇄  ABORTED
 * RUNNING   ←  STARTED          (read only)
 * others    ⇄  state name
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScanStatusMapper {

    public static final String ABORT_REQUESTED = "ABORT-REQUESTED";
    public static final String FINISHED = "FINISHED";
    public static final String ERROR_FAILED = "ERROR-FAILED";
    public static final String ABORTED = "ABORTED";
    public static final String STARTED = "STARTED";

    private ScanStatusMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * State to the status string written to storage.
     *
     * @param state scan state
     * @return legacy status string
     * @throws IllegalArgumentException if state is null
     */
    public static String toDbStatus(ScanState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return switch (state) {
            case STOPPING -> ABORT_REQUESTED;
            case COMPLETED -> FINISHED;
            case FAILED -> ERROR_FAILED;
            case CANCELLED -> ABORTED;
            case CREATED, QUEUED, STARTING, RUNNING, PAUSED -> state.name();
        };
    }

    /**
     * Stored status string to state. Accepts both legacy strings and state names, case-insensitive.
     *
     * @param dbStatus stored status
     * @return scan state
     * @throws IllegalArgumentException if the status is blank or unrecognized
     */
    public static ScanState fromDbStatus(String dbStatus) {
        if (dbStatus == null || dbStatus.isBlank()) {
            throw new IllegalArgumentException("dbStatus cannot be null or blank");
        }
        String normalized = dbStatus.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case ABORT_REQUESTED:
                return ScanState.STOPPING;
            case FINISHED:
                return ScanState.COMPLETED;
            case ERROR_FAILED:
                return ScanState.FAILED;
            case ABORTED:
                return ScanState.CANCELLED;
            case STARTED:
                return ScanState.RUNNING;
            default:
                break;
        }
        try {
            return ScanState.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scan status: " + dbStatus, e);
        }
    }
}
