package com.aiprov.history;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.block.BlockResolutionException;
import com.aiprov.block.FileAnalysis;
import com.aiprov.block.FileAnalyzer;
import com.aiprov.git.FileNotFoundAtRevisionException;
import com.aiprov.git.GitRepository;
import com.aiprov.model.CommitRecord;
import com.aiprov.notes.NotesStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads files and ledger records as they were at a given revision. Inline
 * tags are re-parsed from the historical text on every call; commit records
 * come straight from the ledger since it is keyed by commit id.
 */
public class TemporalReader {
    private static final Logger log = LoggerFactory.getLogger(TemporalReader.class);

    public static final String WORKING_TREE = "WORKING_TREE";

    private final ObjectMapper metadataMapper = JsonMapper.builder().findAndAddModules().build();

    private final GitRepository repository;
    private final NotesStore notesStore;
    private final FileAnalyzer fileAnalyzer;

    public TemporalReader(GitRepository repository, NotesStore notesStore) {
        this(repository, notesStore, new FileAnalyzer());
    }

    public TemporalReader(GitRepository repository, NotesStore notesStore, FileAnalyzer fileAnalyzer) {
        this.repository = repository;
        this.notesStore = notesStore;
        this.fileAnalyzer = fileAnalyzer;
    }

    public static boolean isWorkingTree(String revision) {
        return revision == null || revision.isBlank() || WORKING_TREE.equals(revision);
    }

    public String resolve(String revision) throws IOException {
        if (isWorkingTree(revision)) {
            repository.requireRepository();
            return WORKING_TREE;
        }
        return repository.resolveCommit(revision);
    }

    public FileSnapshot snapshot(String path, String revision) throws IOException, BlockResolutionException {
        String resolved = resolve(revision);
        String normalized = GitRepository.normalizePath(path);
        String text = readText(normalized, resolved);
        FileAnalysis analysis = fileAnalyzer.analyze(normalized, resolved, text);
        return new FileSnapshot(normalized, resolved, text, analysis);
    }

    public Optional<CommitRecord> commitRecord(String revision) throws IOException {
        if (isWorkingTree(revision)) {
            Optional<String> head = repository.resolveRef("HEAD");
            if (head.isEmpty()) {
                return Optional.empty();
            }
            return notesStore.read(head.get());
        }
        return notesStore.read(repository.resolveCommit(revision));
    }

    public List<String> listFiles(String revision) throws IOException {
        String resolved = resolve(revision);
        if (WORKING_TREE.equals(resolved)) {
            return repository.trackedFiles();
        }
        return repository.listFiles(resolved);
    }

    public FileReport fileReport(String path, String revision) throws IOException, BlockResolutionException {
        FileSnapshot snapshot = snapshot(path, revision);
        CommitRecord commit = commitRecord(snapshot.revision()).orElse(null);
        FileMetadata metadata = readMetadata(snapshot.path(), snapshot.revision()).orElse(null);
        return new FileReport(
                snapshot.path(),
                snapshot.revision(),
                snapshot.record(),
                snapshot.analysis().tags(),
                snapshot.analysis().warnings(),
                commit,
                metadata);
    }

    /**
     * The {@code <path>.meta.json} sidecar at {@code revision}. Empty when
     * there is none; an unreadable sidecar is logged and treated as absent.
     */
    public Optional<FileMetadata> fileMetadata(String path, String revision) throws IOException {
        return readMetadata(GitRepository.normalizePath(path), resolve(revision));
    }

    private Optional<FileMetadata> readMetadata(String path, String resolvedRevision) throws IOException {
        String sidecar = FileMetadata.sidecarPath(path);
        String json;
        try {
            json = readText(sidecar, resolvedRevision);
        } catch (FileNotFoundAtRevisionException e) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(metadataMapper.readValue(json, FileMetadata.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable file metadata path={} revision={} reason={}",
                    sidecar, resolvedRevision, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    String readText(String path, String resolvedRevision) throws IOException {
        if (!WORKING_TREE.equals(resolvedRevision)) {
            return repository.readBlob(resolvedRevision, path);
        }
        Path file = repository.workTree().resolve(path).normalize();
        if (!file.startsWith(repository.workTree()) || !Files.isRegularFile(file)) {
            throw new FileNotFoundAtRevisionException(path, WORKING_TREE);
        }
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}
