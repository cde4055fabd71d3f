package com.aiprov;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.block.BlockResolutionException;
import com.aiprov.commit.ProvenanceCommitService;
import com.aiprov.git.RepositoryException;
import com.aiprov.history.FileReport;
import com.aiprov.history.RepositoryScan;
import com.aiprov.model.AiTool;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.Confidence;
import com.aiprov.model.Tag;
import com.aiprov.notes.NotesMergeConflictException;
import com.aiprov.notes.NotesMergePlan;
import com.aiprov.notes.WriteConflictException;
import com.aiprov.report.ProvenanceAggregator;
import com.aiprov.report.TraceEntry;
import com.aiprov.report.ValidationOptions;
import com.aiprov.report.ValidationReport;
import com.aiprov.runtime.AppConfig;
import com.aiprov.runtime.ProvenanceRuntime;
import com.aiprov.tag.TagStamper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "ai-prov",
        mixinStandardHelpOptions = true,
        version = "ai-prov 0.1.0",
        description = "Provenance metadata for AI-assisted code, kept in git notes.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "ai-provenance.yml")
    Path configPath;

    @Option(names = "--mode", converter = ModeConverter.class, defaultValue = "percent",
            description = "Execution mode: percent, unreviewed, trace-matrix, validate, report, notes, stamp, commit, publish, fetch, merge")
    Mode mode;

    @Option(names = "--repo", description = "Repository directory", defaultValue = ".")
    Path repoPath;

    @Option(names = "--rev", description = "Revision to read; the working tree when omitted")
    String revision;

    @Option(names = "--path", description = "Restrict a scan to these path prefixes")
    List<String> pathPrefixes = new ArrayList<>();

    @Option(names = "--file", description = "File for report and stamp modes")
    String file;

    @Option(names = "--requirement", description = "Single requirement id for trace-matrix mode")
    String requirement;

    @Option(names = "--require-review", description = "Fail validation on unreviewed AI commits and tags")
    boolean requireReview;

    @Option(names = "--require-tests", description = "Fail validation on traced work without tests")
    boolean requireTests;

    @Option(names = "--since", description = "Lower bound (exclusive revision or ISO date) for notes mode")
    String since;

    @Option(names = "--until", description = "Upper bound (revision or ISO date) for notes mode")
    String until;

    @Option(names = "--tool", description = "AI tool id for stamp and commit modes")
    String tool;

    @Option(names = "--confidence", description = "Confidence: high, med or low")
    String confidence;

    @Option(names = "--trace", split = ",", description = "Requirement ids")
    List<String> trace = new ArrayList<>();

    @Option(names = "--tests", split = ",", description = "Test ids")
    List<String> tests = new ArrayList<>();

    @Option(names = "--reviewer", description = "Reviewer identity")
    String reviewer;

    @Option(names = "--message", description = "Commit message for commit mode")
    String message;

    @Option(names = "--stage", description = "Stage modified tracked files before committing")
    boolean stageTracked;

    @Option(names = "--position", description = "Where stamp mode inserts a new tag: ${COMPLETION-CANDIDATES}", defaultValue = "TOP")
    TagStamper.Position position;

    @Option(names = "--remote", description = "Remote for publish and fetch modes; notes.remote from config when omitted")
    String remote;

    @Option(names = "--other-ref", description = "Notes ref to merge in merge mode")
    String otherRef;

    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    enum Mode {
        PERCENT("percent"),
        UNREVIEWED("unreviewed"),
        TRACE_MATRIX("trace-matrix"),
        VALIDATE("validate"),
        REPORT("report"),
        NOTES("notes"),
        STAMP("stamp"),
        COMMIT("commit"),
        PUBLISH("publish"),
        FETCH("fetch"),
        MERGE("merge");

        private final String label;

        Mode(String label) {
            this.label = label;
        }

        String label() {
            return label;
        }
    }

    static final class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            String normalized = value.strip().toLowerCase(Locale.ROOT);
            for (Mode candidate : Mode.values()) {
                if (candidate.label().equals(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                    return candidate;
                }
            }
            throw new CommandLine.TypeConversionException("Unknown mode '" + value + "'");
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(configPath);
        ProvenanceRuntime runtime = new ProvenanceRuntime(repoPath, config);
        log.info("Running ai-prov mode={} repo={} rev={}", mode.label(), repoPath, revision == null ? "working tree" : revision);

        try {
            return switch (mode) {
                case PERCENT -> print(runtime.aggregator().percentages(scan(runtime)));
                case UNREVIEWED -> print(runtime.aggregator().unreviewed(scan(runtime)));
                case TRACE_MATRIX -> traceMatrix(runtime);
                case VALIDATE -> validate(runtime, config);
                case REPORT -> report(runtime);
                case NOTES -> notes(runtime);
                case STAMP -> stamp(runtime);
                case COMMIT -> commit(runtime);
                case PUBLISH -> publish(runtime, config);
                case FETCH -> fetch(runtime, config);
                case MERGE -> merge(runtime);
            };
        } catch (NotesMergeConflictException | WriteConflictException e) {
            log.error("{}", e.getMessage());
            return EXIT_FAILED;
        } catch (RepositoryException | IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return EXIT_USAGE;
        }
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private RepositoryScan scan(ProvenanceRuntime runtime) throws IOException {
        return runtime.scanner().scan(revision, pathPrefixes);
    }

    private int traceMatrix(ProvenanceRuntime runtime) throws IOException {
        ProvenanceAggregator aggregator = runtime.aggregator();
        RepositoryScan scan = scan(runtime);
        if (requirement == null || requirement.isBlank()) {
            return print(aggregator.traceMatrix(scan));
        }
        Optional<TraceEntry> entry = aggregator.trace(requirement.strip(), scan);
        if (entry.isEmpty()) {
            log.error("Requirement {} is neither referenced nor in the requirements catalog", requirement);
            return EXIT_USAGE;
        }
        return print(entry.get());
    }

    private int validate(ProvenanceRuntime runtime, AppConfig config) throws IOException {
        ValidationOptions options = new ValidationOptions(
                requireReview || config.getReport().isRequireReview(),
                requireTests || config.getReport().isRequireTests());
        ValidationReport report = runtime.validator().validate(scan(runtime), options);
        print(report);
        return report.passed() ? EXIT_OK : EXIT_FAILED;
    }

    private int report(ProvenanceRuntime runtime) throws IOException {
        if (file == null || file.isBlank()) {
            log.error("--file is required in report mode");
            return EXIT_USAGE;
        }
        try {
            FileReport report = runtime.temporalReader().fileReport(file, revision);
            return print(report);
        } catch (BlockResolutionException e) {
            log.error("Could not resolve blocks path={} line={} reason={}", e.path(), e.lineNumber(), e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int notes(ProvenanceRuntime runtime) throws IOException {
        List<CommitRecord> records;
        try (Stream<CommitRecord> stream = runtime.notesStore().list(since, until)) {
            records = stream.toList();
        }
        return print(records);
    }

    private int stamp(ProvenanceRuntime runtime) throws IOException {
        if (file == null || file.isBlank() || tool == null || tool.isBlank()) {
            log.error("--file and --tool are required in stamp mode");
            return EXIT_USAGE;
        }
        Optional<Confidence> level = confidence == null ? Optional.of(Confidence.MEDIUM) : Confidence.parse(confidence);
        if (level.isEmpty()) {
            log.error("--confidence must be one of high, med, low");
            return EXIT_USAGE;
        }
        Tag tag = new Tag(AiTool.of(tool), level.get(), trace, tests, reviewer, reviewer == null ? null : LocalDate.now());
        Path target = runtime.repository().workTree().resolve(file);
        new TagStamper(runtime.tagParser()).stamp(target, tag, position);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("file", file);
        result.put("tag", tag.format());
        return print(result);
    }

    private int commit(ProvenanceRuntime runtime) throws IOException {
        if (message == null || message.isBlank()) {
            log.error("--message is required in commit mode");
            return EXIT_USAGE;
        }
        Confidence level = null;
        if (confidence != null) {
            Optional<Confidence> parsed = Confidence.parse(confidence);
            if (parsed.isEmpty()) {
                log.error("--confidence must be one of high, med, low");
                return EXIT_USAGE;
            }
            level = parsed.get();
        }
        ProvenanceCommitService service = new ProvenanceCommitService(runtime.repository(), runtime.notesStore());
        ProvenanceCommitService.CommitResult result = service.commit(new ProvenanceCommitService.CommitRequest(
                message,
                tool == null || tool.isBlank() ? null : AiTool.of(tool),
                level,
                trace,
                tests,
                reviewer,
                stageTracked));
        return print(result);
    }

    private int publish(ProvenanceRuntime runtime, AppConfig config) throws IOException {
        String target = remote == null ? config.getNotes().getRemote() : remote;
        runtime.notesStore().publish(target);
        return print(Map.of("remote", target, "ref", runtime.notesStore().notesRef()));
    }

    private int fetch(ProvenanceRuntime runtime, AppConfig config) throws IOException {
        String target = remote == null ? config.getNotes().getRemote() : remote;
        String trackingRef = runtime.notesStore().fetch(target);
        return print(Map.of("remote", target, "trackingRef", trackingRef));
    }

    private int merge(ProvenanceRuntime runtime) throws IOException {
        if (otherRef == null || otherRef.isBlank()) {
            log.error("--other-ref is required in merge mode");
            return EXIT_USAGE;
        }
        NotesMergePlan plan = runtime.notesStore().merge(otherRef);
        return print(plan);
    }

    private int print(Object value) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        out.println(jsonMapper.writeValueAsString(value));
        out.flush();
        return EXIT_OK;
    }
}
