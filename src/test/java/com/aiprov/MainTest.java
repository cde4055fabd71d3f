package com.aiprov;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.aiprov.git.GitFixture;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private GitFixture git;
    private StringWriter out;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(GitFixture.gitAvailable(), "git executable not available");
        git = GitFixture.init(tempDir.resolve("repo"));
        out = new StringWriter();
    }

    @Test
    void shouldPrintPercentagesAsJson() throws Exception {
        git.commit("a.py", "# ai:claude:high\nx = 1\n", "add a");
        git.commit("b.py", "y = 1\ny = 2\n", "add b");

        int exitCode = run("--mode", "percent");

        assertEquals(Main.EXIT_OK, exitCode);
        JsonNode report = mapper.readTree(out.toString());
        assertEquals(2, report.get("fileCount").asInt());
        assertEquals(50.0, report.get("aiPercentage").asDouble(), 1e-9);
        assertEquals("a.py", report.get("files").get(0).get("path").asText());
    }

    @Test
    void shouldFailValidationOfUnreviewedCode() throws Exception {
        git.commit("a.py", "# ai:claude:high\nx = 1\n", "add a");

        assertEquals(Main.EXIT_OK, run("--mode", "validate"));
        out.getBuffer().setLength(0);
        int exitCode = run("--mode", "validate", "--require-review");

        assertEquals(Main.EXIT_FAILED, exitCode);
        JsonNode report = mapper.readTree(out.toString());
        assertEquals(1, report.get("errors").asInt());
        assertEquals("unreviewed-tag", report.get("issues").get(0).get("code").asText());
    }

    @Test
    void shouldCommitAndListNotes() throws Exception {
        git.write("a.py", "x = 1\n");
        git.git("add", "a.py");

        int commitExit = run("--mode", "commit", "--message", "feat: add a", "--tool", "claude",
                "--confidence", "high", "--trace", "SPEC-1,SPEC-2");
        out.getBuffer().setLength(0);
        int notesExit = run("--mode", "notes");

        assertEquals(Main.EXIT_OK, commitExit);
        assertEquals(Main.EXIT_OK, notesExit);
        JsonNode notes = mapper.readTree(out.toString());
        assertEquals(1, notes.size());
        assertEquals(git.git("rev-parse", "HEAD").strip(), notes.get(0).get("commitId").asText());
        assertEquals("claude", notes.get(0).get("aiTool").asText());
        assertEquals("SPEC-2", notes.get(0).get("trace").get(1).asText());
        assertTrue(git.git("log", "-1", "--format=%s").startsWith("[AI:claude:high] feat: add a"));
    }

    @Test
    void shouldStampFileAndReportIt() throws Exception {
        git.commit("a.py", "x = 1\n", "add a");

        int stampExit = run("--mode", "stamp", "--file", "a.py", "--tool", "copilot", "--trace", "SPEC-7");
        out.getBuffer().setLength(0);
        int reportExit = run("--mode", "report", "--file", "a.py");

        assertEquals(Main.EXIT_OK, stampExit);
        assertEquals(Main.EXIT_OK, reportExit);
        assertEquals("# ai:copilot:med | trace:SPEC-7\nx = 1\n", Files.readString(git.directory().resolve("a.py")));
        JsonNode report = mapper.readTree(out.toString());
        assertEquals("WORKING_TREE", report.get("revision").asText());
        assertEquals(100.0, report.get("record").get("aiPercentage").asDouble(), 1e-9);
    }

    @Test
    void shouldReturnUsageErrorForMissingArgumentsAndBadInput() throws Exception {
        git.commit("a.py", "x = 1\n", "add a");

        assertEquals(Main.EXIT_USAGE, run("--mode", "report"));
        assertEquals(Main.EXIT_USAGE, run("--mode", "report", "--file", "a.py", "--rev", "no-such-rev"));
        assertEquals(Main.EXIT_USAGE, run("--mode", "trace-matrix", "--requirement", "SPEC-404"));
        assertEquals(Main.EXIT_USAGE, run("--mode", "merge"));
    }

    @Test
    void shouldReturnUsageErrorOutsideRepository() throws Exception {
        Path plain = Files.createDirectories(tempDir.resolve("plain"));

        assertEquals(Main.EXIT_USAGE, new CommandLine(new Main()).setOut(new PrintWriter(out))
                .execute("--mode", "percent", "--repo", plain.toString(), "--config", tempDir.resolve("none.yml").toString()));
    }

    private int run(String... args) {
        String[] full = new String[args.length + 4];
        System.arraycopy(args, 0, full, 0, args.length);
        full[args.length] = "--repo";
        full[args.length + 1] = git.directory().toString();
        full[args.length + 2] = "--config";
        full[args.length + 3] = tempDir.resolve("none.yml").toString();
        return new CommandLine(new Main()).setOut(new PrintWriter(out)).execute(full);
    }
}
