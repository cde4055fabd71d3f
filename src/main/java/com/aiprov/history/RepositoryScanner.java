package com.aiprov.history;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.block.BlockResolutionException;
import com.aiprov.block.FileAnalysis;
import com.aiprov.block.FileAnalyzer;
import com.aiprov.git.FileNotFoundAtRevisionException;
import com.aiprov.git.GitRepository;
import com.aiprov.model.CommitRecord;
import com.aiprov.notes.NotesStore;
import com.aiprov.tag.MalformedTagException;

/**
 * Collects the aggregator's input for a whole repository at one revision.
 * Problems in individual files are collected; only repository and revision
 * errors abort a scan.
 */
public class RepositoryScanner {
    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    private final GitRepository repository;
    private final NotesStore notesStore;
    private final TemporalReader temporalReader;
    private final FileAnalyzer fileAnalyzer;

    public RepositoryScanner(GitRepository repository, NotesStore notesStore, FileAnalyzer fileAnalyzer) {
        this.repository = repository;
        this.notesStore = notesStore;
        this.fileAnalyzer = fileAnalyzer;
        this.temporalReader = new TemporalReader(repository, notesStore, fileAnalyzer);
    }

    public RepositoryScan scan(String revision, List<String> pathPrefixes) throws IOException {
        String resolved = temporalReader.resolve(revision);
        List<String> prefixes = pathPrefixes == null ? List.of() : pathPrefixes.stream()
                .filter(prefix -> prefix != null && !prefix.isBlank())
                .map(GitRepository::normalizePath)
                .toList();

        List<FileAnalysis> files = new ArrayList<>();
        List<BlockResolutionException> fileErrors = new ArrayList<>();
        List<MalformedTagException> warnings = new ArrayList<>();

        for (String path : temporalReader.listFiles(resolved)) {
            if (!matches(path, prefixes) || FileMetadata.isSidecar(path)) {
                continue;
            }
            String text;
            try {
                text = temporalReader.readText(path, resolved);
            } catch (FileNotFoundAtRevisionException e) {
                log.debug("Skipping tracked file missing from working tree path={}", path);
                continue;
            }
            if (text.indexOf('\0') >= 0) {
                log.debug("Skipping binary file path={}", path);
                continue;
            }
            try {
                FileAnalysis analysis = fileAnalyzer.analyze(path, resolved, text);
                files.add(analysis);
                warnings.addAll(analysis.warnings());
            } catch (BlockResolutionException e) {
                log.warn("Block resolution failed path={} line={} reason={}", e.path(), e.lineNumber(), e.getMessage());
                fileErrors.add(e);
            }
        }

        List<CommitRecord> commits = commitsReachableFrom(resolved);
        log.info("Scanned repository revision={} files={} commits={} fileErrors={} warnings={}",
                resolved, files.size(), commits.size(), fileErrors.size(), warnings.size());
        return new RepositoryScan(resolved, files, commits, fileErrors, warnings);
    }

    private List<CommitRecord> commitsReachableFrom(String resolved) throws IOException {
        String until = resolved;
        if (TemporalReader.WORKING_TREE.equals(resolved)) {
            Optional<String> head = repository.resolveRef("HEAD");
            if (head.isEmpty()) {
                return List.of();
            }
            until = head.get();
        }
        List<CommitRecord> commits = new ArrayList<>();
        try (Stream<CommitRecord> records = notesStore.list(null, until)) {
            records.forEach(commits::add);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return commits;
    }

    private static boolean matches(String path, List<String> prefixes) {
        if (prefixes.isEmpty()) {
            return true;
        }
        for (String prefix : prefixes) {
            String directory = prefix.endsWith("/") ? prefix : prefix + "/";
            if (path.equals(prefix) || path.startsWith(directory)) {
                return true;
            }
        }
        return false;
    }
}
