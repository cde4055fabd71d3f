package com.aiprov.report;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.block.BlockResolutionException;
import com.aiprov.history.RepositoryScan;
import com.aiprov.model.AiTool;
import com.aiprov.model.Block;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.FileRecord;
import com.aiprov.model.Tag;
import com.aiprov.report.ValidationIssue.Severity;
import com.aiprov.tag.MalformedTagException;
import com.aiprov.tag.ToolRegistry;

/**
 * Checks a repository scan against the review and test policy and reports
 * every problem it finds with the commit id or file location.
 */
public class RepositoryValidator {
    private static final Logger log = LoggerFactory.getLogger(RepositoryValidator.class);

    private final ToolRegistry toolRegistry;
    private final RequirementsCatalog catalog;

    public RepositoryValidator() {
        this(ToolRegistry.builtIn(), RequirementsCatalog.none());
    }

    public RepositoryValidator(ToolRegistry toolRegistry, RequirementsCatalog catalog) {
        this.toolRegistry = toolRegistry;
        this.catalog = catalog == null ? RequirementsCatalog.none() : catalog;
    }

    public ValidationReport validate(RepositoryScan scan, ValidationOptions options) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> referenced = new LinkedHashSet<>();

        for (CommitRecord commit : scan.commits()) {
            referenced.addAll(commit.trace());
            checkCommit(commit, options, issues);
        }
        for (FileRecord file : scan.fileRecords()) {
            for (Block block : file.aiBlocks()) {
                referenced.addAll(block.tag().trace());
                checkTag(file.path(), block, options, issues);
            }
        }
        for (MalformedTagException warning : scan.warnings()) {
            issues.add(ValidationIssue.file(Severity.ERROR, "malformed-tag", warning.path(), warning.lineNumber(),
                    warning.reason() + ": " + warning.rawText().strip()));
        }
        for (BlockResolutionException error : scan.fileErrors()) {
            issues.add(ValidationIssue.file(Severity.ERROR, "block-resolution", error.path(), error.lineNumber(),
                    error.getMessage()));
        }
        if (catalog.available()) {
            for (String requirementId : referenced) {
                if (catalog.find(requirementId).isEmpty()) {
                    issues.add(new ValidationIssue(Severity.WARNING, "unknown-requirement", null, null, null,
                            "Requirement " + requirementId + " is referenced but not in the requirements catalog"));
                }
            }
        }

        ValidationReport report = new ValidationReport(issues);
        log.info("Validated revision={} errors={} warnings={}", scan.revision(), report.errorCount(), report.warningCount());
        return report;
    }

    private void checkCommit(CommitRecord commit, ValidationOptions options, List<ValidationIssue> issues) {
        String shortId = abbreviate(commit.commitId());
        if (options.requireReview() && commit.isAiAssisted() && !commit.isReviewed()) {
            issues.add(ValidationIssue.commit(Severity.ERROR, "unreviewed-commit", commit.commitId(),
                    "Commit " + shortId + " has AI code but no review"));
        }
        if (options.requireTests() && !commit.trace().isEmpty() && commit.tests().isEmpty()) {
            issues.add(ValidationIssue.commit(Severity.ERROR, "missing-tests", commit.commitId(),
                    "Commit " + shortId + " has traces (" + String.join(", ", commit.trace()) + ") but no test coverage"));
        }
        if (commit.aiTool() != null) {
            checkTool(commit.aiTool(), issues, ValidationIssue.commit(Severity.WARNING, "unregistered-tool", commit.commitId(),
                    "Commit " + shortId + " names unregistered AI tool '" + commit.aiTool() + "'"));
        }
    }

    private void checkTag(String path, Block block, ValidationOptions options, List<ValidationIssue> issues) {
        Tag tag = block.tag();
        int line = block.startLine();
        if (options.requireReview() && !tag.isReviewed()) {
            issues.add(ValidationIssue.file(Severity.ERROR, "unreviewed-tag", path, line, "AI code not reviewed"));
        }
        if (options.requireTests() && !tag.trace().isEmpty() && tag.tests().isEmpty()) {
            issues.add(ValidationIssue.file(Severity.ERROR, "missing-tests", path, line,
                    "Tag traces (" + String.join(", ", tag.trace()) + ") but names no test"));
        }
        checkTool(tag.tool(), issues, ValidationIssue.file(Severity.WARNING, "unregistered-tool", path, line,
                "Unregistered AI tool '" + tag.tool() + "'"));
    }

    private void checkTool(AiTool tool, List<ValidationIssue> issues, ValidationIssue issue) {
        if (!toolRegistry.isRegistered(tool)) {
            issues.add(issue);
        }
    }

    private static String abbreviate(String commitId) {
        return commitId.length() > 8 ? commitId.substring(0, 8) : commitId;
    }
}
