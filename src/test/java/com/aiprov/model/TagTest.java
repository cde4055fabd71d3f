package com.aiprov.model;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagTest {

    @Test
    void shouldFormatFieldsInFixedOrder() {
        Tag tag = new Tag(AiTool.CLAUDE, Confidence.HIGH, List.of("SPEC-89"), List.of("TC-210", "TC-211"),
                "alice", LocalDate.of(2025, 11, 16));

        assertEquals("ai:claude:high | trace:SPEC-89 | test:TC-210,TC-211 | reviewed:2025-11-16:alice", tag.format());
    }

    @Test
    void shouldOmitEmptyOptionalFields() {
        assertEquals("ai:copilot:med", Tag.of(AiTool.COPILOT, Confidence.MEDIUM).format());
    }

    @Test
    void shouldCollapseDuplicateIdsKeepingFirstSeenOrder() {
        Tag tag = Tag.of(AiTool.CLAUDE, Confidence.LOW).withTrace(List.of("SPEC-2", " SPEC-1", "SPEC-2", ""));

        assertEquals(List.of("SPEC-2", "SPEC-1"), tag.trace());
    }

    @Test
    void shouldRequireReviewerAndDateTogether() {
        assertThrows(IllegalArgumentException.class,
                () -> new Tag(AiTool.CLAUDE, Confidence.HIGH, List.of(), List.of(), "alice", null));
        assertThrows(IllegalArgumentException.class,
                () -> new Tag(AiTool.CLAUDE, Confidence.HIGH, List.of(), List.of(), null, LocalDate.of(2025, 1, 1)));
    }

    @Test
    void shouldRejectIdsThatWouldBreakTheGrammar() {
        Tag tag = Tag.of(AiTool.CLAUDE, Confidence.HIGH);

        assertThrows(IllegalArgumentException.class, () -> tag.withTests(List.of("TC 1")));
        assertThrows(IllegalArgumentException.class, () -> tag.withTrace(List.of("SPEC-1|SPEC-2")));
        assertThrows(IllegalArgumentException.class, () -> tag.withReview("a|b", LocalDate.of(2025, 1, 1)));
    }

    @Test
    void shouldKeepUnknownToolIdsVerbatimButLowerCased() {
        AiTool tool = AiTool.of("Windsurf");

        assertEquals("windsurf", tool.id());
        assertFalse(tool.isKnown());
        assertTrue(AiTool.of("claude").isKnown());
        assertThrows(IllegalArgumentException.class, () -> AiTool.of("bad tool"));
    }
}
