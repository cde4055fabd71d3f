package com.aiprov.commit;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.git.GitRepository;
import com.aiprov.model.AiTool;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.Confidence;
import com.aiprov.notes.NotesStore;

/**
 * Creates a commit whose message follows the {@link CommitMessage}
 * convention and records the same provenance in the notes ledger.
 */
public class ProvenanceCommitService {
    private static final Logger log = LoggerFactory.getLogger(ProvenanceCommitService.class);

    private final GitRepository repository;
    private final NotesStore notesStore;
    private final Clock clock;

    public ProvenanceCommitService(GitRepository repository, NotesStore notesStore) {
        this(repository, notesStore, Clock.systemUTC());
    }

    ProvenanceCommitService(GitRepository repository, NotesStore notesStore, Clock clock) {
        this.repository = repository;
        this.notesStore = notesStore;
        this.clock = clock;
    }

    public CommitResult commit(CommitRequest request) throws IOException {
        Objects.requireNonNull(request, "request");
        repository.requireRepository();

        if (request.stageTracked()) {
            repository.run("add", "-u");
        }
        String message = CommitMessage.compose(request.message(), request.tool(), request.confidence(),
                request.trace(), request.tests(), request.reviewer());
        repository.run("commit", "-m", message);
        String commitId = repository.resolveCommit("HEAD");
        List<String> files = repository.changedFiles(commitId);

        CommitRecord record = null;
        if (request.hasProvenance()) {
            record = notesStore.write(commitId, CommitRecord.builder(commitId)
                    .aiTool(request.tool())
                    .confidence(request.confidence())
                    .trace(request.trace())
                    .tests(request.tests())
                    .reviewedBy(request.reviewer())
                    .reviewedAt(request.reviewer() == null ? null : clock.instant())
                    .files(files)
                    .build());
        }
        log.info("Created provenance commit commit={} tool={} files={} noted={}",
                commitId, request.tool(), files.size(), record != null);
        return new CommitResult(commitId, message, files, record);
    }

    public record CommitRequest(
            String message,
            AiTool tool,
            Confidence confidence,
            List<String> trace,
            List<String> tests,
            String reviewer,
            boolean stageTracked) {

        public CommitRequest {
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("commit message must not be blank");
            }
            if (tool != null && confidence == null) {
                confidence = Confidence.MEDIUM;
            }
            trace = trace == null ? List.of() : List.copyOf(trace);
            tests = tests == null ? List.of() : List.copyOf(tests);
            if (reviewer != null && reviewer.startsWith(CommitMessage.REVIEWER_MARKER)) {
                reviewer = reviewer.substring(CommitMessage.REVIEWER_MARKER.length());
            }
            reviewer = reviewer == null || reviewer.isBlank() ? null : reviewer.strip();
        }

        public boolean hasProvenance() {
            return tool != null || !trace.isEmpty() || !tests.isEmpty() || reviewer != null;
        }
    }

    public record CommitResult(String commitId, String message, List<String> files, CommitRecord record) {
    }
}
