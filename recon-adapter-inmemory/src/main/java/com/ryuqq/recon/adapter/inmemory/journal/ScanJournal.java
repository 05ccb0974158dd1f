package com.ryuqq.recon.adapter.inmemory.journal;

import com.ryuqq.recon.core.model.ScanId;
import com.ryuqq.recon.core.phase.ScanPhase;
import com.ryuqq.recon.core.statemachine.ScanState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded, in-memory journal of scan lifecycle facts.
 *
 * <p>Attach {@link #recordTransition(ScanState, ScanState, ScanId)} as a
 * {@link com.ryuqq.recon.core.statemachine.TransitionListener} and
 * {@link #recordPhaseChange(ScanId, ScanPhase, ScanPhase)} from a
 * {@link com.ryuqq.recon.core.orchestrator.PhaseChangeListener} to keep a queryable
 * history without coupling the core to any storage.</p>
 *
 * <p><strong>Retention:</strong> once {@code maxEntries} is reached the oldest entry is evicted.</p>
 *
 * <p><strong>Thread Safety:</strong> all methods synchronize on a single internal lock.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScanJournal {

    private static final Logger log = LoggerFactory.getLogger(ScanJournal.class);

    /**
     * Default retention.
     */
    public static final int DEFAULT_MAX_ENTRIES = 500;

    private final int maxEntries;
    private final Clock clock;
    private final Object lock = new Object();
    private final Deque<JournalEntry> entries = new ArrayDeque<>();

    private long evicted;

    public ScanJournal() {
        this(DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    /**
     * Creates a journal.
     *
     * @param maxEntries retention, must be positive
     * @param clock clock used for entry timestamps
     * @throws IllegalArgumentException if maxEntries is not positive or clock is null
     */
    public ScanJournal(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive (current: " + maxEntries + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public void recordCreated(ScanId scanId, String target) {
        append(new JournalEntry(scanId, JournalEntryType.SCAN_CREATED, null, null, target, clock.instant()));
    }

    /**
     * Records a state transition. Signature matches
     * {@link com.ryuqq.recon.core.statemachine.TransitionListener#onTransition}.
     *
     * @param oldState previous state
     * @param newState new state
     * @param scanId scan id
     */
    public void recordTransition(ScanState oldState, ScanState newState, ScanId scanId) {
        append(new JournalEntry(scanId, JournalEntryType.STATE_TRANSITION,
            oldState.name(), newState.name(), null, clock.instant()));
    }

    public void recordPhaseChange(ScanId scanId, ScanPhase oldPhase, ScanPhase newPhase) {
        append(new JournalEntry(scanId, JournalEntryType.PHASE_CHANGE,
            oldPhase.name(), newPhase.name(), null, clock.instant()));
    }

    public void recordDeleted(ScanId scanId) {
        append(new JournalEntry(scanId, JournalEntryType.SCAN_DELETED, null, null, null, clock.instant()));
    }

    /**
     * All retained entries for one scan, oldest first.
     *
     * @param scanId scan id
     * @return entries (empty if none)
     */
    public List<JournalEntry> entriesFor(ScanId scanId) {
        synchronized (lock) {
            List<JournalEntry> result = new ArrayList<>();
            for (JournalEntry entry : entries) {
                if (entry.scanId().equals(scanId)) {
                    result.add(entry);
                }
            }
            return result;
        }
    }

    /**
     * The most recent entries across all scans, oldest first.
     *
     * @param limit maximum number of entries
     * @return up to {@code limit} entries
     * @throws IllegalArgumentException if limit is negative
     */
    public List<JournalEntry> recent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative (current: " + limit + ")");
        }
        synchronized (lock) {
            List<JournalEntry> all = new ArrayList<>(entries);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    /**
     * Summary counters.
     *
     * @return total_entries, evicted, scans, max_entries and entry_counts keyed by event name
     */
    public Map<String, Object> stats() {
        synchronized (lock) {
            Map<JournalEntryType, Integer> counts = new EnumMap<>(JournalEntryType.class);
            Set<ScanId> scans = new HashSet<>();
            for (JournalEntry entry : entries) {
                counts.merge(entry.type(), 1, Integer::sum);
                scans.add(entry.scanId());
            }

            Map<String, Integer> entryCounts = new LinkedHashMap<>();
            counts.forEach((type, count) -> entryCounts.put(type.topic(), count));

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("total_entries", entries.size());
            stats.put("evicted", evicted);
            stats.put("scans", scans.size());
            stats.put("max_entries", maxEntries);
            stats.put("entry_counts", entryCounts);
            return stats;
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
            evicted = 0;
        }
    }

    private void append(JournalEntry entry) {
        synchronized (lock) {
            entries.addLast(entry);
            if (entries.size() > maxEntries) {
                entries.removeFirst();
                evicted++;
            }
        }
        log.debug("Journal {} scan_id={} {} → {}",
            entry.type().topic(), entry.scanId().getValue(), entry.from(), entry.to());
    }
}
