package com.ryuqq.recon.adapter.inmemory.journal;

/**
 * Kinds of entries recorded by {@link ScanJournal}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JournalEntryType {

    SCAN_CREATED("scan.created"),
    STATE_TRANSITION("scan.transition"),
    PHASE_CHANGE("scan.phase"),
    SCAN_DELETED("scan.deleted");

    private final String topic;

    JournalEntryType(String topic) {
        this.topic = topic;
    }

    /**
     * Event name used when the entry is published or serialized.
     *
     * @return dotted event name
     */
    public String topic() {
        return topic;
    }
}
