package com.ryuqq.recon.adapter.inmemory.journal;

import com.ryuqq.recon.core.model.ScanId;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One recorded lifecycle fact about a scan.
 *
 * <p>{@code from}/{@code to} hold state names for transitions, phase names for phase changes,
 * and are null for creation and deletion entries. {@code detail} carries the target on creation.</p>
 *
 * @param scanId scan id
 * @param type entry type
 * @param from previous state or phase (nullable)
 * @param to new state or phase (nullable)
 * @param detail free-form detail (nullable)
 * @param timestamp time recorded
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JournalEntry(
    ScanId scanId,
    JournalEntryType type,
    String from,
    String to,
    String detail,
    Instant timestamp
) {

    public JournalEntry {
        if (scanId == null) {
            throw new IllegalArgumentException("scanId cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("event", type.topic());
        map.put("scan_id", scanId.getValue());
        map.put("from", from);
        map.put("to", to);
        map.put("detail", detail);
        map.put("timestamp", timestamp.toEpochMilli());
        return map;
    }
}
