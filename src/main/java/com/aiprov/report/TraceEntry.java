package com.aiprov.report;

import java.math.BigDecimal;
import java.util.List;

public record TraceEntry(
        String requirementId,
        String title,
        String requirementStatus,
        boolean unknown,
        List<String> commits,
        List<String> files,
        List<String> tests,
        double aiPercentage,
        BigDecimal display,
        ReviewStatus reviewStatus) {

    public static final String UNKNOWN_TITLE = "(unknown)";

    public TraceEntry {
        commits = List.copyOf(commits);
        files = List.copyOf(files);
        tests = List.copyOf(tests);
    }
}
