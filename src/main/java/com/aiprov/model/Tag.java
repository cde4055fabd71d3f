package com.aiprov.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public record Tag(
        AiTool tool,
        Confidence confidence,
        List<String> trace,
        List<String> tests,
        String reviewer,
        LocalDate reviewedAt) {

    public static final String MARKER = "ai:";

    public Tag {
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(confidence, "confidence");
        trace = Identifiers.distinct(trace);
        tests = Identifiers.distinct(tests);
        reviewer = Identifiers.blankToNull(reviewer);
        if ((reviewer == null) != (reviewedAt == null)) {
            throw new IllegalArgumentException("reviewer and reviewedAt must be given together");
        }
        if (reviewer != null && (reviewer.contains("|") || reviewer.contains("\n") || reviewer.contains("\r"))) {
            throw new IllegalArgumentException("reviewer must not contain '|' or line breaks: " + reviewer);
        }
    }

    public static Tag of(AiTool tool, Confidence confidence) {
        return new Tag(tool, confidence, List.of(), List.of(), null, null);
    }

    public Tag withTrace(Collection<String> ids) {
        return new Tag(tool, confidence, new ArrayList<>(ids), tests, reviewer, reviewedAt);
    }

    public Tag withTests(Collection<String> ids) {
        return new Tag(tool, confidence, trace, new ArrayList<>(ids), reviewer, reviewedAt);
    }

    public Tag withReview(String reviewer, LocalDate reviewedAt) {
        return new Tag(tool, confidence, trace, tests, reviewer, reviewedAt);
    }

    public boolean isReviewed() {
        return reviewer != null;
    }

    public String format() {
        StringBuilder text = new StringBuilder(MARKER)
                .append(tool.id())
                .append(':')
                .append(confidence.code());
        if (!trace.isEmpty()) {
            text.append(" | trace:").append(String.join(",", trace));
        }
        if (!tests.isEmpty()) {
            text.append(" | test:").append(String.join(",", tests));
        }
        if (reviewer != null) {
            text.append(" | reviewed:").append(reviewedAt).append(':').append(reviewer);
        }
        return text.toString();
    }
}
