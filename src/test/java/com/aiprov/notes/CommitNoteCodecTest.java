package com.aiprov.notes;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.aiprov.model.AiTool;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.Confidence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommitNoteCodecTest {

    private final CommitNoteCodec codec = new CommitNoteCodec();

    @Test
    void shouldEncodeSingleLineInFixedKeyOrderWithoutEmptyFields() {
        CommitRecord record = CommitRecord.builder("abc123")
                .files(List.of("src/a.py"))
                .trace(List.of("SPEC-1"))
                .confidence(Confidence.HIGH)
                .aiTool(AiTool.CLAUDE)
                .reviewedBy("alice")
                .reviewedAt(Instant.parse("2025-11-16T10:00:00Z"))
                .build();

        String note = codec.encode(record);

        assertEquals("{\"ai_tool\":\"claude\",\"confidence\":\"high\",\"trace\":[\"SPEC-1\"],"
                + "\"reviewed_by\":\"alice\",\"reviewed_at\":\"2025-11-16T10:00:00Z\",\"files\":[\"src/a.py\"]}", note);
        assertFalse(note.contains("\n"));
        assertFalse(note.contains("abc123"));
    }

    @Test
    void shouldDecodeLegacyPrettyPrintedNotes() throws Exception {
        String legacy = "{\n"
                + "  \"ai_tool\": \"windsurf\",\n"
                + "  \"confidence\": \"med\",\n"
                + "  \"tests\": [\"TC-1\", \"TC-1\"],\n"
                + "  \"reviewed_at\": \"2025-01-02T03:04:05\",\n"
                + "  \"session\": {\"id\": 7}\n"
                + "}\n";

        CommitRecord record = codec.decode("abc123", legacy);

        assertEquals("abc123", record.commitId());
        assertEquals("windsurf", record.aiTool().id());
        assertFalse(record.aiTool().isKnown());
        assertEquals(Confidence.MEDIUM, record.confidence());
        assertEquals(List.of("TC-1"), record.tests());
        assertEquals(Instant.parse("2025-01-02T03:04:05Z"), record.reviewedAt());
        assertNull(record.reviewedBy());
    }

    @Test
    void shouldReadPlainDatesAndOffsets() throws Exception {
        assertEquals(Instant.parse("2025-03-01T00:00:00Z"),
                codec.decode("c", "{\"reviewed_at\":\"2025-03-01\"}").reviewedAt());
        assertEquals(Instant.parse("2025-03-01T08:00:00Z"),
                codec.decode("c", "{\"reviewed_at\":\"2025-03-01T10:00:00+02:00\"}").reviewedAt());
    }

    @Test
    void shouldRejectUnreadableNotes() {
        for (String payload : List.of("", "not json", "null", "{\"confidence\":\"sure\"}", "{\"reviewed_at\":\"yesterday\"}")) {
            MalformedNoteException error = assertThrows(MalformedNoteException.class, () -> codec.decode("abc123", payload), payload);
            assertEquals("abc123", error.commitId());
            assertTrue(error.getMessage().startsWith("Note for commit abc123"));
        }
    }
}
