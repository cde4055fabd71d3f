package com.aiprov.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileRecordTest {

    private static final Tag CLAUDE = Tag.of(AiTool.CLAUDE, Confidence.HIGH).withTrace(List.of("SPEC-1"));

    @Test
    void shouldComputePercentageOverNonBlankLines() {
        FileRecord record = new FileRecord("app.py", "abc", List.of(
                Block.untagged(1, 4, 3),
                new Block(BlockKind.FUNCTION, "handler", 5, 10, 6, CLAUDE)), null);

        assertEquals(9, record.countedLines());
        assertEquals(6, record.aiLines());
        assertEquals(600.0 / 9, record.aiPercentage(), 1e-9);
    }

    @Test
    void shouldReportZeroForEmptyFileAndNullForBlankOnlyFile() {
        FileRecord empty = new FileRecord("empty.py", "abc", List.of(), null);
        FileRecord blank = new FileRecord("blank.py", "abc", List.of(Block.untagged(1, 3, 0)), null);

        assertEquals(0.0, empty.aiPercentage());
        assertNull(blank.aiPercentage());
    }

    @Test
    void shouldRejectOverlappingBlocks() {
        assertThrows(IllegalArgumentException.class, () -> new FileRecord("app.py", "abc", List.of(
                Block.untagged(1, 5, 5),
                new Block(BlockKind.GENERIC, null, 5, 8, 4, CLAUDE)), null));
    }

    @Test
    void shouldRejectBlockWithMoreCountedLinesThanItSpans() {
        assertThrows(IllegalArgumentException.class, () -> new Block(BlockKind.GENERIC, null, 3, 4, 3, null));
        assertThrows(IllegalArgumentException.class, () -> Block.untagged(5, 4, 0));
    }

    @Test
    void shouldUnionTraceAndTestIdsAcrossTags() {
        Tag other = Tag.of(AiTool.COPILOT, Confidence.LOW).withTrace(List.of("SPEC-2", "SPEC-1")).withTests(List.of("TC-9"));
        FileRecord record = new FileRecord("app.py", "abc", List.of(
                new Block(BlockKind.GENERIC, null, 1, 2, 2, CLAUDE),
                new Block(BlockKind.GENERIC, null, 3, 4, 2, other)), null);

        assertEquals(List.of("SPEC-1", "SPEC-2"), record.traceIds());
        assertEquals(List.of("TC-9"), record.testIds());
        assertEquals(4, record.lineCount());
    }
}
