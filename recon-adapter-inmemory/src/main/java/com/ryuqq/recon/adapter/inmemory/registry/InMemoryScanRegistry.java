package com.ryuqq.recon.adapter.inmemory.registry;

import com.ryuqq.recon.adapter.inmemory.journal.ScanJournal;
import com.ryuqq.recon.core.model.ScanId;
import com.ryuqq.recon.core.orchestrator.OrchestratorConfig;
import com.ryuqq.recon.core.orchestrator.ScanOrchestrator;
import com.ryuqq.recon.core.statemachine.InvalidTransitionException;
import com.ryuqq.recon.core.statemachine.ScanState;
import com.ryuqq.recon.core.statemachine.ScanStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of running scans, the service-side entry point for lifecycle requests.
 *
 * <p>Each scan gets a {@link ScanStateMachine} and a {@link ScanOrchestrator}. The registry
 * wires both to the shared {@link ScanJournal} and keeps the legacy status string of every
 * scan current through a transition listener, so {@link #getDbStatus(ScanId)} always reflects
 * what a database-backed implementation would have written.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>scans:</strong> ConcurrentHashMap&lt;ScanId, RegisteredScan&gt;</li>
 *   <li><strong>dbStatuses:</strong> ConcurrentHashMap&lt;ScanId, String&gt; - persisted legacy status</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryScanRegistry registry = new InMemoryScanRegistry();
 * RegisteredScan scan = registry.create(ScanId.of("scan-001"), "example.com");
 * scan.stateMachine().transition(ScanState.QUEUED);
 *
 * String status = registry.stop(ScanId.of("scan-001"), "User abort via API"); // "ABORTED"
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryScanRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScanRegistry.class);

    private static final String DEFAULT_STOP_REASON = "Stop requested";

    private final ScanJournal journal;
    private final OrchestratorConfig orchestratorConfig;
    private final Clock clock;

    private final ConcurrentHashMap<ScanId, RegisteredScan> scans = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ScanId, String> dbStatuses = new ConcurrentHashMap<>();

    public InMemoryScanRegistry() {
        this(new ScanJournal(), new OrchestratorConfig(), Clock.systemUTC());
    }

    /**
     * Creates a registry.
     *
     * @param journal journal every scan is attached to
     * @param orchestratorConfig configuration for new orchestrators
     * @param clock clock handed to machines and orchestrators
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryScanRegistry(ScanJournal journal, OrchestratorConfig orchestratorConfig, Clock clock) {
        if (journal == null) {
            throw new IllegalArgumentException("journal cannot be null");
        }
        if (orchestratorConfig == null) {
            throw new IllegalArgumentException("orchestratorConfig cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.journal = journal;
        this.orchestratorConfig = orchestratorConfig;
        this.clock = clock;
    }

    /**
     * Registers a new scan in CREATED.
     *
     * @param scanId scan id
     * @param target scan target
     * @return the registered scan
     * @throws ScanRegistryException if the id is already registered
     */
    public RegisteredScan create(ScanId scanId, String target) {
        RegisteredScan scan = newScan(scanId, target, ScanState.CREATED);
        if (scans.putIfAbsent(scanId, scan) != null) {
            throw new ScanRegistryException("Scan already exists: " + scanId.getValue());
        }
        attach(scan);
        journal.recordCreated(scanId, target);
        log.info("Scan {} created for target {}", scanId.getValue(), target);
        return scan;
    }

    /**
     * Rebuilds a scan from its stored status, for scans created by an earlier process.
     *
     * <p>Returns the existing entry when the id is already registered.</p>
     *
     * @param scanId scan id
     * @param target scan target
     * @param dbStatus stored status (legacy string or state name)
     * @return the registered scan
     * @throws IllegalArgumentException if dbStatus is not recognized
     */
    public RegisteredScan restore(ScanId scanId, String target, String dbStatus) {
        ScanState initial = ScanStatusMapper.fromDbStatus(dbStatus);
        RegisteredScan candidate = newScan(scanId, target, initial);
        RegisteredScan existing = scans.putIfAbsent(scanId, candidate);
        if (existing != null) {
            return existing;
        }
        attach(candidate);
        log.info("Scan {} restored in {} from stored status {}", scanId.getValue(), initial, dbStatus);
        return candidate;
    }

    public Optional<RegisteredScan> find(ScanId scanId) {
        return Optional.ofNullable(scanId == null ? null : scans.get(scanId));
    }

    public Optional<ScanStateMachine> findStateMachine(ScanId scanId) {
        return find(scanId).map(RegisteredScan::stateMachine);
    }

    public Optional<ScanOrchestrator> findOrchestrator(ScanId scanId) {
        return find(scanId).map(RegisteredScan::orchestrator);
    }

    public String stop(ScanId scanId) {
        return stop(scanId, DEFAULT_STOP_REASON);
    }

    /**
     * Requests a stop.
     *
     * <p>Moves the scan to STOPPING when it is running or paused, otherwise to CANCELLED.</p>
     *
     * @param scanId scan id
     * @param reason transition reason
     * @return the legacy status written for the new state
     * @throws ScanRegistryException if the scan is unknown or already terminal
     */
    public String stop(ScanId scanId, String reason) {
        ScanStateMachine machine = require(scanId).stateMachine();

        for (ScanState target : new ScanState[]{ScanState.STOPPING, ScanState.CANCELLED}) {
            if (!machine.canTransition(target)) {
                continue;
            }
            try {
                ScanState newState = machine.transition(target, reason);
                String dbStatus = ScanStatusMapper.toDbStatus(newState);
                log.info("Scan {} stop requested: {} ({})", scanId.getValue(), newState, dbStatus);
                return dbStatus;
            } catch (InvalidTransitionException e) {
                log.debug("Scan {} changed state during stop request, retrying: {}", scanId.getValue(), e.getMessage());
            }
        }
        throw new ScanRegistryException(
            "Cannot stop scan " + scanId.getValue() + " in state " + machine.getState()
        );
    }

    /**
     * Removes a scan.
     *
     * @param scanId scan id
     * @return true if it was registered
     */
    public boolean delete(ScanId scanId) {
        RegisteredScan removed = scanId == null ? null : scans.remove(scanId);
        if (removed == null) {
            return false;
        }
        dbStatuses.remove(scanId);
        journal.recordDeleted(scanId);
        log.info("Scan {} deleted", scanId.getValue());
        return true;
    }

    /**
     * Status API payload: the state machine snapshot plus {@code db_status} and the orchestrator summary.
     *
     * @param scanId scan id
     * @return nested map
     * @throws ScanRegistryException if the scan is unknown
     */
    public Map<String, Object> getScanState(ScanId scanId) {
        RegisteredScan scan = require(scanId);
        Map<String, Object> map = new LinkedHashMap<>(scan.stateMachine().toMap());
        map.put("target", scan.target());
        map.put("db_status", ScanStatusMapper.toDbStatus(scan.stateMachine().getState()));
        map.put("orchestrator", scan.orchestrator().summary().toMap());
        return map;
    }

    public Optional<String> getDbStatus(ScanId scanId) {
        return Optional.ofNullable(scanId == null ? null : dbStatuses.get(scanId));
    }

    /**
     * All registered scans ordered by id.
     *
     * @return immutable list
     */
    public List<RegisteredScan> list() {
        return scans.values().stream()
            .sorted(Comparator.comparing(RegisteredScan::scanId))
            .toList();
    }

    public int size() {
        return scans.size();
    }

    public ScanJournal getJournal() {
        return journal;
    }

    public void clear() {
        scans.clear();
        dbStatuses.clear();
    }

    private RegisteredScan newScan(ScanId scanId, String target, ScanState initial) {
        if (scanId == null) {
            throw new IllegalArgumentException("scanId cannot be null");
        }
        ScanStateMachine machine = new ScanStateMachine(scanId, initial, clock);
        ScanOrchestrator orchestrator = new ScanOrchestrator(scanId, target, orchestratorConfig, clock);
        return new RegisteredScan(scanId, target, machine, orchestrator);
    }

    private void attach(RegisteredScan scan) {
        ScanId scanId = scan.scanId();
        dbStatuses.put(scanId, ScanStatusMapper.toDbStatus(scan.stateMachine().getState()));
        scan.stateMachine().onTransition(journal::recordTransition);
        scan.stateMachine().onTransition((oldState, newState, id) -> {
            if (scans.get(id) == scan) {
                dbStatuses.put(id, ScanStatusMapper.toDbStatus(newState));
            }
        });
        scan.orchestrator().onPhaseChange((oldPhase, newPhase) -> journal.recordPhaseChange(scanId, oldPhase, newPhase));
    }

    private RegisteredScan require(ScanId scanId) {
        return find(scanId).orElseThrow(() -> new ScanRegistryException(
            "Scan not found: " + (scanId == null ? null : scanId.getValue())
        ));
    }
}
