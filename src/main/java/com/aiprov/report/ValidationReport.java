package com.aiprov.report;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ValidationReport(List<ValidationIssue> issues) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    @JsonProperty("errors")
    public long errorCount() {
        return issues.stream().filter(issue -> issue.severity() == ValidationIssue.Severity.ERROR).count();
    }

    @JsonProperty("warnings")
    public long warningCount() {
        return issues.stream().filter(issue -> issue.severity() == ValidationIssue.Severity.WARNING).count();
    }

    @JsonProperty("passed")
    public boolean passed() {
        return errorCount() == 0;
    }

    public List<ValidationIssue> issuesFor(String commitIdOrPath) {
        return issues.stream()
                .filter(issue -> commitIdOrPath.equals(issue.commitId()) || commitIdOrPath.equals(issue.path()))
                .toList();
    }
}
