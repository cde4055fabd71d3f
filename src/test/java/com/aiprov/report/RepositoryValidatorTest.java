package com.aiprov.report;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.aiprov.block.BlockResolutionException;
import com.aiprov.block.FileAnalysis;
import com.aiprov.block.FileAnalyzer;
import com.aiprov.history.RepositoryScan;
import com.aiprov.model.AiTool;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.Confidence;
import com.aiprov.tag.ToolRegistry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RepositoryValidatorTest {

    private final FileAnalyzer analyzer = new FileAnalyzer();

    @Test
    void shouldRequireTestsForTracedCommit() {
        CommitRecord commit = CommitRecord.builder("abc123")
                .aiTool(AiTool.CLAUDE)
                .confidence(Confidence.HIGH)
                .trace(List.of("SPEC-001"))
                .build();

        ValidationReport report = new RepositoryValidator().validate(scan(List.of(), List.of(commit)), new ValidationOptions(false, true));

        assertFalse(report.passed());
        assertEquals(1, report.errorCount());
        ValidationIssue issue = report.issuesFor("abc123").get(0);
        assertEquals("missing-tests", issue.code());
        assertEquals("Commit abc123 has traces (SPEC-001) but no test coverage", issue.message());
    }

    @Test
    void shouldPassLenientPolicyWithOnlyWarnings() throws Exception {
        FileAnalysis file = analyzer.analyze("a.py", "rev", "# ai:windsurf:high | trace:SPEC-1\nx = 1\n");
        CommitRecord commit = CommitRecord.builder("0123456789abcdef").aiTool(AiTool.of("windsurf")).confidence(Confidence.LOW).build();

        ValidationReport report = new RepositoryValidator().validate(scan(List.of(file), List.of(commit)), ValidationOptions.lenient());

        assertTrue(report.passed());
        assertEquals(2, report.warningCount());
        assertEquals("Commit 01234567 names unregistered AI tool 'windsurf'", report.issuesFor("0123456789abcdef").get(0).message());
        assertEquals(Integer.valueOf(1), report.issuesFor("a.py").get(0).line());
    }

    @Test
    void shouldAcceptToolsRegisteredInConfiguration() throws Exception {
        FileAnalysis file = analyzer.analyze("a.py", "rev", "# ai:windsurf:high\nx = 1\n");
        RepositoryValidator validator = new RepositoryValidator(new ToolRegistry(List.of("windsurf")), RequirementsCatalog.none());

        ValidationReport report = validator.validate(scan(List.of(file), List.of()), ValidationOptions.lenient());

        assertTrue(report.issues().isEmpty());
    }

    @Test
    void shouldRequireReviewOfCommitsAndTags() throws Exception {
        FileAnalysis file = analyzer.analyze("a.py", "rev",
                "x = 1\n# ai:claude:high\ny = 2\n# ai:claude:low | reviewed:2025-02-03:bob\nz = 3\n");
        CommitRecord unreviewed = CommitRecord.builder("c1").aiTool(AiTool.CLAUDE).confidence(Confidence.HIGH).build();
        CommitRecord reviewed = CommitRecord.builder("c2").aiTool(AiTool.CLAUDE).confidence(Confidence.HIGH).reviewedBy("alice").build();
        CommitRecord human = CommitRecord.builder("c3").trace(List.of("SPEC-1")).build();

        ValidationReport report = new RepositoryValidator().validate(
                scan(List.of(file), List.of(unreviewed, reviewed, human)), new ValidationOptions(true, false));

        assertEquals(List.of("unreviewed-commit", "unreviewed-tag"), report.issues().stream().map(ValidationIssue::code).toList());
        assertEquals("c1", report.issues().get(0).commitId());
        assertEquals("a.py", report.issues().get(1).path());
        assertEquals(Integer.valueOf(2), report.issues().get(1).line());
    }

    @Test
    void shouldReportMalformedTagsAndFileErrors() throws Exception {
        FileAnalysis file = analyzer.analyze("a.py", "rev", "x = 1\n# ai:claude:certain\n");
        RepositoryScan scan = new RepositoryScan("rev", List.of(file), List.of(),
                List.of(new BlockResolutionException("b.py", 4, "blocks overlap at line 4")), file.warnings());

        ValidationReport report = new RepositoryValidator().validate(scan, ValidationOptions.lenient());

        assertEquals(2, report.errorCount());
        ValidationIssue malformed = report.issuesFor("a.py").get(0);
        assertEquals("malformed-tag", malformed.code());
        assertEquals(Integer.valueOf(2), malformed.line());
        assertEquals("unknown confidence 'certain': # ai:claude:certain", malformed.message());
        assertEquals("block-resolution", report.issuesFor("b.py").get(0).code());
    }

    @Test
    void shouldWarnAboutUnknownRequirementsOnlyWithCatalog() throws Exception {
        FileAnalysis file = analyzer.analyze("a.py", "rev", "# ai:claude:high | trace:SPEC-1,SPEC-2\nx = 1\n");
        RequirementsCatalog catalog = new YamlRequirementsCatalog(List.of(new Requirement("SPEC-1", "Login", "done")));

        ValidationReport withCatalog = new RepositoryValidator(ToolRegistry.builtIn(), catalog)
                .validate(scan(List.of(file), List.of()), ValidationOptions.lenient());
        ValidationReport withoutCatalog = new RepositoryValidator()
                .validate(scan(List.of(file), List.of()), ValidationOptions.lenient());

        assertEquals(1, withCatalog.warningCount());
        assertEquals("unknown-requirement", withCatalog.issues().get(0).code());
        assertTrue(withCatalog.issues().get(0).message().contains("SPEC-2"));
        assertTrue(withoutCatalog.issues().isEmpty());
    }

    private static RepositoryScan scan(List<FileAnalysis> files, List<CommitRecord> commits) {
        return new RepositoryScan("rev", files, commits, List.of(), List.of());
    }
}
