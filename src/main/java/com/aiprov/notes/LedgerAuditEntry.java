package com.aiprov.notes;

import java.time.Instant;

public record LedgerAuditEntry(
        Instant timestamp,
        String operation,
        String notesRef,
        String commitId,
        String actor,
        String details) {
}
