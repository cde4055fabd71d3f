package com.aiprov.report;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(
        Severity severity,
        String code,
        String commitId,
        String path,
        Integer line,
        String message) {

    public enum Severity {
        ERROR,
        WARNING
    }

    static ValidationIssue commit(Severity severity, String code, String commitId, String message) {
        return new ValidationIssue(severity, code, commitId, null, null, message);
    }

    static ValidationIssue file(Severity severity, String code, String path, int line, String message) {
        return new ValidationIssue(severity, code, null, path, line > 0 ? line : null, message);
    }
}
