package com.aiprov.model;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommitRecordTest {

    @Test
    void shouldNormalizeListsAndBlankReviewer() {
        CommitRecord record = CommitRecord.builder("abc123")
                .aiTool(AiTool.CLAUDE)
                .confidence(Confidence.HIGH)
                .trace(List.of("SPEC-001", "SPEC-001"))
                .files(List.of("a.py", "a.py", "b.py"))
                .reviewedBy("  ")
                .build();

        assertEquals(List.of("SPEC-001"), record.trace());
        assertEquals(List.of("a.py", "b.py"), record.files());
        assertTrue(record.isAiAssisted());
        assertFalse(record.isReviewed());
    }

    @Test
    void shouldRequireCommitId() {
        assertThrows(NullPointerException.class, () -> CommitRecord.builder(" ").build());
    }

    @Test
    void shouldReplaceOnlyCommitId() {
        CommitRecord record = CommitRecord.builder("abc123")
                .reviewedBy("alice")
                .reviewedAt(Instant.parse("2025-11-16T10:00:00Z"))
                .build();

        CommitRecord renamed = record.withCommitId("f".repeat(40));

        assertEquals("f".repeat(40), renamed.commitId());
        assertEquals(record.reviewedAt(), renamed.reviewedAt());
        assertFalse(renamed.isAiAssisted());
        assertTrue(renamed.isReviewed());
    }
}
