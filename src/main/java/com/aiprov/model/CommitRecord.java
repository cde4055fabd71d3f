package com.aiprov.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public record CommitRecord(
        String commitId,
        AiTool aiTool,
        Confidence confidence,
        List<String> trace,
        List<String> tests,
        String reviewedBy,
        Instant reviewedAt,
        List<String> files) {

    public CommitRecord {
        commitId = Identifiers.blankToNull(commitId);
        Objects.requireNonNull(commitId, "commitId");
        trace = Identifiers.distinct(trace);
        tests = Identifiers.distinct(tests);
        reviewedBy = Identifiers.blankToNull(reviewedBy);
        files = distinctPaths(files);
    }

    public static Builder builder(String commitId) {
        return new Builder(commitId);
    }

    public CommitRecord withCommitId(String newCommitId) {
        return new CommitRecord(newCommitId, aiTool, confidence, trace, tests, reviewedBy, reviewedAt, files);
    }

    public boolean isAiAssisted() {
        return aiTool != null || confidence != null;
    }

    public boolean isReviewed() {
        return reviewedBy != null;
    }

    private static List<String> distinctPaths(Collection<String> paths) {
        if (paths == null || paths.isEmpty()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String path : paths) {
            if (path != null && !path.isBlank() && !result.contains(path)) {
                result.add(path);
            }
        }
        return List.copyOf(result);
    }

    public static final class Builder {
        private final String commitId;
        private AiTool aiTool;
        private Confidence confidence;
        private List<String> trace = List.of();
        private List<String> tests = List.of();
        private String reviewedBy;
        private Instant reviewedAt;
        private List<String> files = List.of();

        private Builder(String commitId) {
            this.commitId = commitId;
        }

        public Builder aiTool(AiTool aiTool) {
            this.aiTool = aiTool;
            return this;
        }

        public Builder confidence(Confidence confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder trace(Collection<String> trace) {
            this.trace = trace == null ? List.of() : new ArrayList<>(trace);
            return this;
        }

        public Builder tests(Collection<String> tests) {
            this.tests = tests == null ? List.of() : new ArrayList<>(tests);
            return this;
        }

        public Builder reviewedBy(String reviewedBy) {
            this.reviewedBy = reviewedBy;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder files(Collection<String> files) {
            this.files = files == null ? List.of() : new ArrayList<>(files);
            return this;
        }

        public CommitRecord build() {
            return new CommitRecord(commitId, aiTool, confidence, trace, tests, reviewedBy, reviewedAt, files);
        }
    }
}
