package com.aiprov.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.block.BlockResolver;
import com.aiprov.block.FileAnalyzer;
import com.aiprov.git.GitCommandRunner;
import com.aiprov.git.GitRepository;
import com.aiprov.history.RepositoryScanner;
import com.aiprov.history.TemporalReader;
import com.aiprov.notes.GitNotesStore;
import com.aiprov.report.ProvenanceAggregator;
import com.aiprov.report.RepositoryValidator;
import com.aiprov.report.RequirementsCatalog;
import com.aiprov.report.YamlRequirementsCatalog;
import com.aiprov.tag.CommentStyleRegistry;
import com.aiprov.tag.TagParser;
import com.aiprov.tag.ToolRegistry;

public class ProvenanceRuntime {
    private static final Logger log = LoggerFactory.getLogger(ProvenanceRuntime.class);

    private final AppConfig config;
    private final GitRepository repository;
    private final GitNotesStore notesStore;
    private final TagParser tagParser;
    private final FileAnalyzer fileAnalyzer;
    private final ToolRegistry toolRegistry;

    public ProvenanceRuntime(Path repositoryDirectory, AppConfig config) {
        this(new GitRepository(
                repositoryDirectory,
                config.getGit().getExecutable(),
                new GitCommandRunner(Duration.ofSeconds(Math.max(1, config.getGit().getTimeoutSeconds())))), config);
    }

    ProvenanceRuntime(GitRepository repository, AppConfig config) {
        this.config = config;
        this.repository = repository;
        AppConfig.NotesConfig notes = config.getNotes();
        this.notesStore = new GitNotesStore(repository, notes.getRef(), notes.getMaxWriteAttempts(),
                notes.getAuditLogPath() == null ? null : Path.of(notes.getAuditLogPath()));
        this.tagParser = new TagParser(commentStyles(config.getTags()));
        this.fileAnalyzer = new FileAnalyzer(tagParser, new BlockResolver());
        this.toolRegistry = new ToolRegistry(config.getTags().getAdditionalTools());
    }

    public AppConfig config() {
        return config;
    }

    public GitRepository repository() {
        return repository;
    }

    public GitNotesStore notesStore() {
        return notesStore;
    }

    public TagParser tagParser() {
        return tagParser;
    }

    public TemporalReader temporalReader() {
        return new TemporalReader(repository, notesStore, fileAnalyzer);
    }

    public RepositoryScanner scanner() {
        return new RepositoryScanner(repository, notesStore, fileAnalyzer);
    }

    public RequirementsCatalog requirementsCatalog() throws IOException {
        AppConfig.ReportConfig report = config.getReport();
        if (report.getRequirementsPath() == null || report.getRequirementsPath().isBlank()) {
            return RequirementsCatalog.none();
        }
        Path workTree = repository.workTree();
        Path mapping = report.getMappingPath() == null || report.getMappingPath().isBlank()
                ? null
                : workTree.resolve(report.getMappingPath());
        return YamlRequirementsCatalog.load(workTree.resolve(report.getRequirementsPath()), mapping);
    }

    public ProvenanceAggregator aggregator() throws IOException {
        return new ProvenanceAggregator(requirementsCatalog(), config.getReport().getPercentageScale());
    }

    public RepositoryValidator validator() throws IOException {
        return new RepositoryValidator(toolRegistry, requirementsCatalog());
    }

    static CommentStyleRegistry commentStyles(AppConfig.TagsConfig tags) {
        CommentStyleRegistry.Builder builder = CommentStyleRegistry.builder();
        for (Map.Entry<String, List<String>> entry : tags.getCommentStyles().entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                continue;
            }
            builder.style(entry.getKey(), entry.getValue());
            log.debug("Configured comment style language={} prefixes={}", entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, String> entry : tags.getExtensions().entrySet()) {
            builder.extension(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }
}
