package com.aiprov.history;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.aiprov.block.FileAnalyzer;
import com.aiprov.git.FileNotFoundAtRevisionException;
import com.aiprov.git.GitFixture;
import com.aiprov.git.GitRepository;
import com.aiprov.git.NotARepositoryException;
import com.aiprov.git.ScriptedGitRunner;
import com.aiprov.git.UnknownRevisionException;
import com.aiprov.model.AiTool;
import com.aiprov.model.BlockKind;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.Confidence;
import com.aiprov.model.FileRecord;
import com.aiprov.notes.GitNotesStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class TemporalReaderTest {

    @TempDir
    Path tempDir;

    private GitFixture git;
    private GitNotesStore notesStore;
    private TemporalReader reader;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(GitFixture.gitAvailable(), "git executable not available");
        git = GitFixture.init(tempDir.resolve("repo"));
        notesStore = new GitNotesStore(git.repository());
        reader = new TemporalReader(git.repository(), notesStore);
    }

    @Test
    void shouldReparseTagsFromHistoricalText() throws Exception {
        String tagged = git.commit("src/a.py", "# ai:claude:high | trace:SPEC-7\nx = 1\n", "add a");
        String untagged = git.commit("src/a.py", "x = 1\ny = 2\n", "drop tag");

        FileSnapshot before = reader.snapshot("./src/a.py", tagged);
        FileSnapshot after = reader.snapshot("src/a.py", untagged);

        assertEquals("src/a.py", before.path());
        assertEquals(tagged, before.revision());
        assertEquals(100.0, before.record().aiPercentage());
        assertEquals(List.of("SPEC-7"), before.record().traceIds());
        assertEquals(0.0, after.record().aiPercentage());
        assertEquals(untagged, reader.resolve("HEAD"));
    }

    @Test
    void shouldReadWorkingTreeFromDisk() throws Exception {
        git.commit("a.py", "x = 1\n", "add a");
        Files.writeString(git.directory().resolve("a.py"), "# ai:copilot:med\nx = 1\n");

        FileSnapshot snapshot = reader.snapshot("a.py", null);

        assertEquals(TemporalReader.WORKING_TREE, snapshot.revision());
        assertEquals(100.0, snapshot.record().aiPercentage());
        assertEquals(List.of("a.py"), reader.listFiles(TemporalReader.WORKING_TREE));
        assertThrows(FileNotFoundAtRevisionException.class, () -> reader.snapshot("../outside.py", null));
    }

    @Test
    void shouldRaiseTypedErrorsForBadIdentifiers() throws Exception {
        String commit = git.commit("a.py", "x = 1\n", "add a");

        UnknownRevisionException unknown = assertThrows(UnknownRevisionException.class, () -> reader.snapshot("a.py", "no-such-branch"));
        FileNotFoundAtRevisionException missing = assertThrows(FileNotFoundAtRevisionException.class,
                () -> reader.snapshot("b.py", commit));

        assertEquals("no-such-branch", unknown.revision());
        assertEquals("b.py", missing.path());
        assertEquals(commit, missing.revision());
    }

    @Test
    void shouldAttachLedgerRecordOfRevision() throws Exception {
        String first = git.commit("a.py", "# ai:claude:high\nx = 1\n", "add a");
        String second = git.commit("a.py", "# ai:claude:high\nx = 2\n", "change a");
        notesStore.write(first, CommitRecord.builder(first)
                .aiTool(AiTool.CLAUDE)
                .confidence(Confidence.HIGH)
                .build());

        FileReport historical = reader.fileReport("a.py", first);
        FileReport current = reader.fileReport("a.py", second);

        assertEquals(first, historical.commit().commitId());
        assertEquals(1, historical.tags().size());
        assertTrue(historical.warnings().isEmpty());
        assertNull(current.commit());
        assertTrue(reader.commitRecord(TemporalReader.WORKING_TREE).isEmpty());
    }

    @Test
    void shouldAttachFileMetadataSidecarAtRevision() throws Exception {
        String before = git.commit("src/auth.py", "def login():\n    pass\n", "add auth");
        git.write("src/auth.py.meta.json", """
                {
                  "file": "src/auth.py",
                  "generated_at": "2025-11-16T13:38:00",
                  "ai_tool": "claude",
                  "confidence": "high",
                  "trace": ["SPEC-89"],
                  "tests": ["TC-210"],
                  "reviewed_by": "alice@example.com",
                  "blocks": [
                    {"kind": "function", "name": "login", "lines": [1, 2], "ai": true, "trace": "SPEC-89"},
                    {"kind": "block", "name": "tail", "lines": [3, 8], "ai": false}
                  ]
                }
                """);
        git.git("add", "src/auth.py.meta.json");
        git.git("commit", "-q", "-m", "add metadata");
        String after = git.git("rev-parse", "HEAD").strip();

        FileReport report = reader.fileReport("src/auth.py", after);
        FileMetadata metadata = report.metadata();

        assertEquals(AiTool.CLAUDE, metadata.aiTool());
        assertEquals(Confidence.HIGH, metadata.confidence());
        assertEquals(List.of("SPEC-89"), metadata.trace());
        assertEquals("alice@example.com", metadata.reviewedBy());
        assertEquals(Instant.parse("2025-11-16T13:38:00Z"), metadata.generatedAt());
        assertEquals(BlockKind.FUNCTION, metadata.blocks().get(0).kind());
        assertEquals(25.0, metadata.aiPercentage(), 1e-9);
        assertNull(reader.fileReport("src/auth.py", before).metadata());
        assertEquals(List.of("src/auth.py"), new RepositoryScanner(git.repository(), notesStore, new FileAnalyzer())
                .scan(after, null).fileRecords().stream().map(FileRecord::path).toList());
    }

    @Test
    void shouldTreatUnreadableFileMetadataAsAbsent() throws Exception {
        git.write("a.py.meta.json", "{\"blocks\": [{\"kind\": \"function\", \"name\": \"f\", \"lines\": [5, 2]}]}");
        git.git("add", "a.py.meta.json");
        String commit = git.commit("a.py", "x = 1\n", "add a");

        assertTrue(reader.fileMetadata("a.py", commit).isEmpty());
        assertNull(reader.fileReport("a.py", commit).metadata());
        assertEquals(1, reader.fileReport("a.py", commit).record().countedLines());
    }

    @Test
    void shouldReportMissingRepository() {
        ScriptedGitRunner runner = new ScriptedGitRunner()
                .on("rev-parse --show-toplevel", ScriptedGitRunner.failure(128, "fatal: not a git repository"));
        TemporalReader outside = new TemporalReader(new GitRepository(tempDir, "git", runner), notesStore);

        assertThrows(NotARepositoryException.class, () -> outside.snapshot("a.py", "HEAD"));
        assertThrows(NotARepositoryException.class, () -> outside.snapshot("a.py", null));
    }
}
