package com.aiprov.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private GitConfig git = new GitConfig();
    private NotesConfig notes = new NotesConfig();
    private TagsConfig tags = new TagsConfig();
    private ReportConfig report = new ReportConfig();

    public GitConfig getGit() {
        return git;
    }

    public void setGit(GitConfig git) {
        this.git = git == null ? new GitConfig() : git;
    }

    public NotesConfig getNotes() {
        return notes;
    }

    public void setNotes(NotesConfig notes) {
        this.notes = notes == null ? new NotesConfig() : notes;
    }

    public TagsConfig getTags() {
        return tags;
    }

    public void setTags(TagsConfig tags) {
        this.tags = tags == null ? new TagsConfig() : tags;
    }

    public ReportConfig getReport() {
        return report;
    }

    public void setReport(ReportConfig report) {
        this.report = report == null ? new ReportConfig() : report;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitConfig {
        private String executable = "git";
        private int timeoutSeconds = 30;

        public String getExecutable() {
            return executable;
        }

        public void setExecutable(String executable) {
            this.executable = executable;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NotesConfig {
        private String ref = "refs/notes/ai-provenance";
        private int maxWriteAttempts = 3;
        private String remote = "origin";
        private String auditLogPath = ".ai-prov/ledger-audit.log";

        public String getRef() {
            return ref;
        }

        public void setRef(String ref) {
            this.ref = ref;
        }

        public int getMaxWriteAttempts() {
            return maxWriteAttempts;
        }

        public void setMaxWriteAttempts(int maxWriteAttempts) {
            this.maxWriteAttempts = maxWriteAttempts;
        }

        public String getRemote() {
            return remote;
        }

        public void setRemote(String remote) {
            this.remote = remote;
        }

        public String getAuditLogPath() {
            return auditLogPath;
        }

        public void setAuditLogPath(String auditLogPath) {
            this.auditLogPath = auditLogPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TagsConfig {
        private List<String> additionalTools = new ArrayList<>();
        private Map<String, List<String>> commentStyles = new LinkedHashMap<>();
        private Map<String, String> extensions = new LinkedHashMap<>();

        public List<String> getAdditionalTools() {
            return additionalTools;
        }

        public void setAdditionalTools(List<String> additionalTools) {
            this.additionalTools = additionalTools == null ? new ArrayList<>() : additionalTools;
        }

        public Map<String, List<String>> getCommentStyles() {
            return commentStyles;
        }

        public void setCommentStyles(Map<String, List<String>> commentStyles) {
            this.commentStyles = commentStyles == null ? new LinkedHashMap<>() : commentStyles;
        }

        public Map<String, String> getExtensions() {
            return extensions;
        }

        public void setExtensions(Map<String, String> extensions) {
            this.extensions = extensions == null ? new LinkedHashMap<>() : extensions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReportConfig {
        private int percentageScale = 0;
        private String requirementsPath = "requirements.yaml";
        private String mappingPath = ".requirements-mapping.yaml";
        private boolean requireReview = false;
        private boolean requireTests = false;

        public int getPercentageScale() {
            return percentageScale;
        }

        public void setPercentageScale(int percentageScale) {
            this.percentageScale = percentageScale;
        }

        public String getRequirementsPath() {
            return requirementsPath;
        }

        public void setRequirementsPath(String requirementsPath) {
            this.requirementsPath = requirementsPath;
        }

        public String getMappingPath() {
            return mappingPath;
        }

        public void setMappingPath(String mappingPath) {
            this.mappingPath = mappingPath;
        }

        public boolean isRequireReview() {
            return requireReview;
        }

        public void setRequireReview(boolean requireReview) {
            this.requireReview = requireReview;
        }

        public boolean isRequireTests() {
            return requireTests;
        }

        public void setRequireTests(boolean requireTests) {
            this.requireTests = requireTests;
        }
    }
}
