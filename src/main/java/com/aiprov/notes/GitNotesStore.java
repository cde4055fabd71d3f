package com.aiprov.notes;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.git.GitCommandResult;
import com.aiprov.git.GitRepository;
import com.aiprov.git.UnknownRevisionException;
import com.aiprov.model.CommitRecord;

/**
 * {@link NotesStore} kept in a git notes ref. Updates are built on a private
 * transaction ref and published with a compare-and-swap {@code update-ref}, so
 * a concurrent writer is detected instead of overwritten.
 */
public class GitNotesStore implements NotesStore {
    private static final Logger log = LoggerFactory.getLogger(GitNotesStore.class);

    public static final Path DEFAULT_AUDIT_LOG = Path.of(".ai-prov", "ledger-audit.log");
    static final String REMOTE_NOTES_PREFIX = "refs/notes/remotes/";
    private static final String NOTES_PREFIX = "refs/notes/";
    private static final Pattern DATE_BOUND = Pattern.compile("\\d{4}-\\d{2}-\\d{2}([T ].*)?");
    private static final Pattern OBJECT_ID = Pattern.compile("[0-9a-f]{40}([0-9a-f]{24})?");

    private final GitRepository repository;
    private final String notesRef;
    private final int maxWriteAttempts;
    private final Path auditLogPath;
    private final CommitNoteCodec codec;
    private final LedgerAuditLog auditLog;
    private final Clock clock;

    public GitNotesStore(GitRepository repository) {
        this(repository, DEFAULT_REF, 3, DEFAULT_AUDIT_LOG);
    }

    public GitNotesStore(GitRepository repository, String notesRef, int maxWriteAttempts, Path auditLogPath) {
        this(repository, notesRef, maxWriteAttempts, auditLogPath, new CommitNoteCodec(), new LedgerAuditLog(), Clock.systemUTC());
    }

    GitNotesStore(
            GitRepository repository,
            String notesRef,
            int maxWriteAttempts,
            Path auditLogPath,
            CommitNoteCodec codec,
            LedgerAuditLog auditLog,
            Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.notesRef = notesRef == null || notesRef.isBlank() ? DEFAULT_REF : qualify(notesRef);
        this.maxWriteAttempts = Math.max(1, maxWriteAttempts);
        this.auditLogPath = auditLogPath == null ? DEFAULT_AUDIT_LOG : auditLogPath;
        this.codec = codec;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public String notesRef() {
        return notesRef;
    }

    @Override
    public CommitRecord write(String commitId, CommitRecord record) throws IOException {
        Objects.requireNonNull(record, "record");
        String sha = repository.resolveCommit(commitId);
        CommitRecord stored = record.withCommitId(sha);
        String payload = codec.encode(stored);

        int attempts = update(sha, txnRef -> {
            repository.run("notes", "--ref=" + txnRef, "add", "-f", "-m", payload, sha);
        });
        log.info("Wrote provenance note commit={} ref={} attempts={}", sha, notesRef, attempts);
        audit("write", sha, payload);
        return stored;
    }

    @Override
    public Optional<CommitRecord> read(String commitId) throws IOException {
        String sha = repository.resolveCommit(commitId);
        GitCommandResult result = repository.execute("notes", "--ref=" + notesRef, "show", sha);
        if (!result.isSuccess()) {
            if (result.stderr().toLowerCase().contains("no note found")) {
                return Optional.empty();
            }
            log.error("Reading note failed commit={} ref={} exitCode={} stderr={}",
                    sha, notesRef, result.exitCode(), result.trimmedStderr());
            throw new IOException("Could not read note for " + sha + " from " + notesRef + ": " + result.trimmedStderr());
        }
        return Optional.of(codec.decode(sha, result.stdout()));
    }

    @Override
    public Stream<CommitRecord> list(String since, String until) throws IOException {
        repository.requireRepository();
        Optional<String> head = repository.resolveRef(notesRef);
        if (head.isEmpty()) {
            return Stream.empty();
        }
        Map<String, String> notes = noteBlobs(head.get());
        if (notes.isEmpty()) {
            return Stream.empty();
        }

        List<String> args = new ArrayList<>(List.of("rev-list", "--date-order"));
        if (until == null || until.isBlank() || isDate(until)) {
            if (until != null && !until.isBlank()) {
                args.add("--until=" + until.strip());
            }
            repository.resolveRef("HEAD").ifPresent(args::add);
            args.add("--branches");
            args.add("--tags");
            args.add("--remotes");
        } else {
            args.add(repository.resolveCommit(until.strip()));
        }
        if (since != null && !since.isBlank()) {
            if (isDate(since)) {
                args.add("--since=" + since.strip());
            } else {
                args.add("^" + repository.resolveCommit(since.strip()));
            }
        }

        List<String> commits = repository.run(args.toArray(String[]::new)).lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
        return commits.stream()
                .filter(notes::containsKey)
                .map(commit -> decodeBlob(commit, notes.get(commit)))
                .flatMap(Optional::stream);
    }

    @Override
    public boolean remove(String commitId, String reason) throws IOException {
        String sha = repository.resolveCommit(commitId);
        if (read(sha).isEmpty()) {
            return false;
        }
        int attempts = update(sha, txnRef -> {
            GitCommandResult result = repository.execute("notes", "--ref=" + txnRef, "remove", "--ignore-missing", sha);
            if (!result.isSuccess()) {
                throw new IOException("Could not remove note for " + sha + ": " + result.trimmedStderr());
            }
        });
        log.warn("Purged provenance note commit={} ref={} attempts={} reason={}", sha, notesRef, attempts, reason);
        audit("purge", sha, reason == null ? "" : reason);
        return true;
    }

    @Override
    public NotesMergePlan detectMerge(String otherRef) throws IOException {
        repository.requireRepository();
        String other = qualify(otherRef);
        String theirs = repository.resolveRef(other).orElseThrow(() -> new UnknownRevisionException(other));
        Optional<String> ours = repository.resolveRef(notesRef);

        Map<String, String> ourNotes = Map.of();
        Map<String, String> baseNotes = Map.of();
        if (ours.isPresent()) {
            ourNotes = noteBlobs(ours.get());
            Optional<String> base = mergeBase(ours.get(), theirs);
            if (base.isPresent()) {
                baseNotes = noteBlobs(base.get());
            }
        }
        return NotesMergePlanner.plan(baseNotes, ourNotes, noteBlobs(theirs));
    }

    @Override
    public NotesMergePlan merge(String otherRef) throws IOException {
        String other = qualify(otherRef);
        NotesMergePlan plan = detectMerge(other);
        if (plan.hasConflicts()) {
            log.warn("Notes merge needs manual resolution ref={} other={} conflicts={}", notesRef, other, plan.conflicts());
            throw new NotesMergeConflictException(other, plan.conflicts());
        }
        if (!plan.changesOurs()) {
            log.info("Notes already up to date ref={} other={}", notesRef, other);
            return plan;
        }

        Optional<String> ours = repository.resolveRef(notesRef);
        if (ours.isEmpty()) {
            String theirs = repository.resolveRef(other).orElseThrow(() -> new UnknownRevisionException(other));
            GitCommandResult result = repository.execute("update-ref", notesRef, theirs, "");
            if (!result.isSuccess()) {
                throw new WriteConflictException(other, notesRef, 1);
            }
        } else {
            GitCommandResult result = repository.execute("notes", "--ref=" + notesRef, "merge", "--quiet", other);
            if (!result.isSuccess()) {
                GitCommandResult abort = repository.execute("notes", "--ref=" + notesRef, "merge", "--abort");
                if (!abort.isSuccess()) {
                    log.warn("Could not abort notes merge ref={} stderr={}", notesRef, abort.trimmedStderr());
                }
                log.error("Notes merge failed ref={} other={} stderr={}", notesRef, other, result.trimmedStderr());
                throw new IOException("Notes merge of " + other + " into " + notesRef + " failed: " + result.trimmedStderr());
            }
        }
        log.info("Merged notes ref={} other={} taken={} dropped={}", notesRef, other, plan.takeTheirs().size(), plan.drop().size());
        audit("merge", null, other);
        return plan;
    }

    /**
     * Pushes the notes ref to {@code remote}. Nothing is ever published
     * implicitly.
     */
    public void publish(String remote) throws IOException {
        repository.run("push", remote, notesRef + ":" + notesRef);
        log.info("Published notes ref={} remote={}", notesRef, remote);
    }

    public String fetch(String remote) throws IOException {
        String name = notesRef.startsWith(NOTES_PREFIX)
                ? notesRef.substring(NOTES_PREFIX.length())
                : notesRef.substring(notesRef.lastIndexOf('/') + 1);
        String trackingRef = REMOTE_NOTES_PREFIX + remote + "/" + name;
        repository.run("fetch", remote, "+" + notesRef + ":" + trackingRef);
        log.info("Fetched notes ref={} remote={} into={}", notesRef, remote, trackingRef);
        return trackingRef;
    }

    private int update(String commitId, NoteMutation mutation) throws IOException {
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            Optional<String> expected = repository.resolveRef(notesRef);
            String txnRef = notesRef + "-txn-" + UUID.randomUUID();
            try {
                if (expected.isPresent()) {
                    repository.run("update-ref", txnRef, expected.get());
                }
                mutation.apply(txnRef);
                String newHead = repository.resolveRef(txnRef)
                        .orElseThrow(() -> new IOException("Transaction ref " + txnRef + " was not created"));

                GitCommandResult swap = repository.execute("update-ref", notesRef, newHead, expected.orElse(""));
                if (swap.isSuccess()) {
                    return attempt;
                }
                Optional<String> current = repository.resolveRef(notesRef);
                if (current.equals(expected)) {
                    log.error("Updating notes ref failed ref={} commit={} stderr={}", notesRef, commitId, swap.trimmedStderr());
                    throw new IOException("Could not update " + notesRef + " for " + commitId + ": " + swap.trimmedStderr());
                }
                log.debug("Notes ref moved concurrently ref={} commit={} attempt={}", notesRef, commitId, attempt);
            } finally {
                discard(txnRef);
            }
        }
        throw new WriteConflictException(commitId, notesRef, maxWriteAttempts);
    }

    private void discard(String txnRef) throws IOException {
        if (repository.resolveRef(txnRef).isEmpty()) {
            return;
        }
        GitCommandResult result = repository.execute("update-ref", "-d", txnRef);
        if (!result.isSuccess()) {
            log.warn("Could not delete transaction ref ref={} stderr={}", txnRef, result.trimmedStderr());
        }
    }

    Map<String, String> noteBlobs(String notesCommit) throws IOException {
        Map<String, String> notes = new LinkedHashMap<>();
        for (String entry : repository.run("ls-tree", "-r", "-z", notesCommit).split("\0")) {
            int tab = entry.indexOf('\t');
            if (tab < 0) {
                continue;
            }
            String[] meta = entry.substring(0, tab).strip().split(" ");
            String commit = entry.substring(tab + 1).replace("/", "");
            if (meta.length == 3 && "blob".equals(meta[1]) && OBJECT_ID.matcher(commit).matches()) {
                notes.put(commit, meta[2]);
            }
        }
        return notes;
    }

    private Optional<CommitRecord> decodeBlob(String commit, String blob) {
        try {
            return Optional.of(codec.decode(commit, repository.run("cat-file", "blob", blob)));
        } catch (MalformedNoteException e) {
            log.warn("Skipping undecodable note commit={} reason={}", commit, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Optional<String> mergeBase(String ours, String theirs) throws IOException {
        GitCommandResult result = repository.execute("merge-base", ours, theirs);
        if (!result.isSuccess() || result.trimmedStdout().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(result.trimmedStdout());
    }

    private void audit(String operation, String commitId, String details) throws IOException {
        Path target = auditLogPath.isAbsolute() ? auditLogPath : repository.workTree().resolve(auditLogPath);
        auditLog.append(target, new LedgerAuditEntry(
                clock.instant(),
                operation,
                notesRef,
                commitId,
                System.getProperty("user.name", "unknown"),
                details));
    }

    private static boolean isDate(String bound) {
        return DATE_BOUND.matcher(bound.strip()).matches();
    }

    private static String qualify(String ref) {
        String trimmed = ref.strip();
        if (trimmed.startsWith("refs/")) {
            return trimmed;
        }
        if (trimmed.startsWith("notes/")) {
            return "refs/" + trimmed;
        }
        return NOTES_PREFIX + trimmed;
    }

    @FunctionalInterface
    interface NoteMutation {
        void apply(String txnRef) throws IOException;
    }
}
