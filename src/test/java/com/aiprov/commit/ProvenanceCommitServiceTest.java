package com.aiprov.commit;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.aiprov.git.GitRepository;
import com.aiprov.git.ScriptedGitRunner;
import com.aiprov.model.AiTool;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.Confidence;
import com.aiprov.notes.NotesMergePlan;
import com.aiprov.notes.NotesStore;

import static com.aiprov.git.ScriptedGitRunner.ok;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProvenanceCommitServiceTest {
    private static final String SHA = "89abcdef0123456789abcdef0123456789abcdef";

    @TempDir
    Path workTree;

    private final Clock clock = Clock.fixed(Instant.parse("2025-11-16T10:00:00Z"), ZoneOffset.UTC);
    private final InMemoryNotesStore notesStore = new InMemoryNotesStore();

    @Test
    void shouldCommitWithConventionAndRecordNote() throws Exception {
        ScriptedGitRunner runner = scriptedCommit();
        ProvenanceCommitService service = new ProvenanceCommitService(new GitRepository(workTree, "git", runner), notesStore, clock);

        ProvenanceCommitService.CommitResult result = service.commit(new ProvenanceCommitService.CommitRequest(
                "feat: add limiter", AiTool.CLAUDE, Confidence.HIGH, List.of("SPEC-1"), List.of("TC-1"), "AI+alice", true));

        String expectedMessage = "[AI:claude:high] feat: add limiter\n\nTrace: SPEC-1\nTest: TC-1\nReviewed-by: AI+alice";
        assertEquals(expectedMessage, result.message());
        assertEquals(SHA, result.commitId());
        assertEquals(List.of("src/a.py", "src/b.py"), result.files());
        assertTrue(runner.commands().contains("add -u"));
        assertTrue(runner.commands().contains("commit -m " + expectedMessage));

        CommitRecord record = notesStore.records.get(SHA);
        assertEquals(result.record(), record);
        assertEquals("alice", record.reviewedBy());
        assertEquals(clock.instant(), record.reviewedAt());
        assertEquals(List.of("src/a.py", "src/b.py"), record.files());
    }

    @Test
    void shouldSkipNoteForHumanCommit() throws Exception {
        ScriptedGitRunner runner = scriptedCommit();
        ProvenanceCommitService service = new ProvenanceCommitService(new GitRepository(workTree, "git", runner), notesStore, clock);

        ProvenanceCommitService.CommitResult result = service.commit(new ProvenanceCommitService.CommitRequest(
                "docs: fix typo", null, null, null, null, null, false));

        assertNull(result.record());
        assertTrue(notesStore.records.isEmpty());
        assertEquals(0, runner.count("add"));
        assertTrue(runner.commands().contains("commit -m docs: fix typo"));
    }

    @Test
    void shouldDefaultConfidenceAndValidateRequest() {
        ProvenanceCommitService.CommitRequest request = new ProvenanceCommitService.CommitRequest(
                "feat: x", AiTool.COPILOT, null, List.of(), List.of(), " ", false);

        assertEquals(Confidence.MEDIUM, request.confidence());
        assertNull(request.reviewer());
        assertThrows(IllegalArgumentException.class,
                () -> new ProvenanceCommitService.CommitRequest(" ", AiTool.CLAUDE, null, null, null, null, false));
    }

    private ScriptedGitRunner scriptedCommit() {
        return ScriptedGitRunner.forWorkTree(workTree)
                .on("rev-parse --verify --quiet HEAD^{commit}", ok(SHA + "\n"))
                .on("diff-tree --root --no-commit-id --name-only -r -z " + SHA, ok("src/a.py\0src/b.py\0"));
    }

    static final class InMemoryNotesStore implements NotesStore {
        final Map<String, CommitRecord> records = new LinkedHashMap<>();

        @Override
        public CommitRecord write(String commitId, CommitRecord record) {
            CommitRecord stored = record.withCommitId(commitId);
            records.put(commitId, stored);
            return stored;
        }

        @Override
        public Optional<CommitRecord> read(String commitId) {
            return Optional.ofNullable(records.get(commitId));
        }

        @Override
        public Stream<CommitRecord> list(String since, String until) {
            List<CommitRecord> newestFirst = new ArrayList<>(records.values());
            Collections.reverse(newestFirst);
            return newestFirst.stream();
        }

        @Override
        public boolean remove(String commitId, String reason) {
            return records.remove(commitId) != null;
        }

        @Override
        public NotesMergePlan detectMerge(String otherRef) throws IOException {
            throw new IOException("merging is not supported in memory");
        }

        @Override
        public NotesMergePlan merge(String otherRef) throws IOException {
            throw new IOException("merging is not supported in memory");
        }
    }
}
