package com.aiprov.report;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.history.RepositoryScan;
import com.aiprov.model.Block;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.FileRecord;
import com.aiprov.model.Tag;

/**
 * Queries over file and commit records: AI share, unreviewed work and the
 * requirement traceability matrix. Every query is a pure function of its
 * inputs and the requirements catalog.
 */
public class ProvenanceAggregator {
    private static final Logger log = LoggerFactory.getLogger(ProvenanceAggregator.class);

    private static final Comparator<FilePercentage> HIGHEST_SHARE_FIRST = Comparator
            .comparing(FilePercentage::aiPercentage, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(FilePercentage::path);

    private final RequirementsCatalog catalog;
    private final int percentageScale;

    public ProvenanceAggregator() {
        this(RequirementsCatalog.none(), 0);
    }

    public ProvenanceAggregator(RequirementsCatalog catalog, int percentageScale) {
        this.catalog = catalog == null ? RequirementsCatalog.none() : catalog;
        this.percentageScale = percentageScale;
    }

    public PercentageReport percentages(RepositoryScan scan) {
        return percentages(scan.fileRecords());
    }

    public PercentageReport percentages(Collection<FileRecord> files) {
        long counted = 0;
        long ai = 0;
        List<FilePercentage> perFile = new ArrayList<>();
        for (FileRecord file : files) {
            counted += file.countedLines();
            ai += file.aiLines();
            Double share = file.aiPercentage();
            perFile.add(new FilePercentage(file.path(), file.countedLines(), file.aiLines(), share,
                    Percentages.display(share, percentageScale)));
        }
        perFile.sort(HIGHEST_SHARE_FIRST);

        Double total = files.isEmpty() ? Double.valueOf(0.0) : Percentages.ratio(ai, counted);
        return new PercentageReport(files.size(), counted, ai, total, Percentages.display(total, percentageScale), perFile);
    }

    public List<UnreviewedItem> unreviewed(RepositoryScan scan) {
        return unreviewed(scan.fileRecords(), scan.commits());
    }

    public List<UnreviewedItem> unreviewed(Collection<FileRecord> files, Collection<CommitRecord> commits) {
        List<UnreviewedItem> items = new ArrayList<>();
        for (CommitRecord commit : commits) {
            if (commit.confidence() != null && !commit.isReviewed()) {
                items.add(UnreviewedItem.commit(commit.commitId(), commit.aiTool(), commit.confidence()));
            }
        }
        for (FileRecord file : files) {
            for (Block block : file.aiBlocks()) {
                Tag tag = block.tag();
                if (!tag.isReviewed()) {
                    items.add(UnreviewedItem.block(file.path(), block.startLine(), block.endLine(), tag.tool(), tag.confidence()));
                }
            }
        }
        return items;
    }

    public List<TraceEntry> traceMatrix(RepositoryScan scan) {
        return traceMatrix(scan.fileRecords(), scan.commits());
    }

    public List<TraceEntry> traceMatrix(Collection<FileRecord> files, Collection<CommitRecord> commits) {
        Map<String, Links> links = collectLinks(files, commits);
        for (Requirement requirement : catalog.all()) {
            links.computeIfAbsent(requirement.id(), id -> new Links());
        }
        List<TraceEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Links> entry : links.entrySet()) {
            entries.add(toEntry(entry.getKey(), entry.getValue()));
        }
        return entries;
    }

    public Optional<TraceEntry> trace(String requirementId, RepositoryScan scan) {
        return trace(requirementId, scan.fileRecords(), scan.commits());
    }

    public Optional<TraceEntry> trace(String requirementId, Collection<FileRecord> files, Collection<CommitRecord> commits) {
        Links found = collectLinks(files, commits).get(requirementId);
        if (found == null) {
            if (catalog.find(requirementId).isEmpty()) {
                return Optional.empty();
            }
            found = new Links();
        }
        return Optional.of(toEntry(requirementId, found));
    }

    private Map<String, Links> collectLinks(Collection<FileRecord> files, Collection<CommitRecord> commits) {
        Map<String, FileRecord> filesByPath = new LinkedHashMap<>();
        for (FileRecord file : files) {
            filesByPath.putIfAbsent(file.path(), file);
        }
        Map<String, Links> links = new TreeMap<>();
        for (CommitRecord commit : commits) {
            for (String requirementId : commit.trace()) {
                links.computeIfAbsent(requirementId, id -> new Links()).addCommit(commit, filesByPath);
            }
        }
        for (FileRecord file : files) {
            for (Block block : file.aiBlocks()) {
                for (String requirementId : block.tag().trace()) {
                    links.computeIfAbsent(requirementId, id -> new Links()).addTag(file, block.tag());
                }
            }
        }
        return links;
    }

    private TraceEntry toEntry(String requirementId, Links links) {
        String title = "";
        String status = null;
        boolean unknown = false;
        if (catalog.available()) {
            Optional<Requirement> requirement = catalog.find(requirementId);
            if (requirement.isPresent()) {
                title = requirement.get().title();
                status = requirement.get().status();
            } else {
                title = TraceEntry.UNKNOWN_TITLE;
                unknown = true;
                log.warn("Requirement referenced but not in catalog requirement={} commits={} files={}",
                        requirementId, links.commits.size(), links.files.size());
            }
        }
        double share = links.aiPercentage();
        return new TraceEntry(
                requirementId,
                title,
                status,
                unknown,
                new ArrayList<>(links.commits),
                new ArrayList<>(links.files),
                new ArrayList<>(links.tests),
                share,
                Percentages.display(share, percentageScale),
                links.reviewStatus());
    }

    private static final class Links {
        private final Set<String> commits = new LinkedHashSet<>();
        private final Set<String> files = new LinkedHashSet<>();
        private final Set<String> tests = new LinkedHashSet<>();
        private final Map<String, FileRecord> contributingFiles = new LinkedHashMap<>();
        private int commitCount;
        private int aiCommitCount;
        private boolean aiInvolved;
        private boolean allReviewed = true;

        void addCommit(CommitRecord commit, Map<String, FileRecord> filesByPath) {
            commits.add(commit.commitId());
            files.addAll(commit.files());
            for (String path : commit.files()) {
                FileRecord file = filesByPath.get(path);
                if (file != null) {
                    contributingFiles.putIfAbsent(path, file);
                }
            }
            tests.addAll(commit.tests());
            commitCount++;
            if (commit.isAiAssisted()) {
                aiCommitCount++;
                aiInvolved = true;
                allReviewed &= commit.isReviewed();
            }
        }

        void addTag(FileRecord file, Tag tag) {
            files.add(file.path());
            tests.addAll(tag.tests());
            contributingFiles.putIfAbsent(file.path(), file);
            aiInvolved = true;
            allReviewed &= tag.isReviewed();
        }

        double aiPercentage() {
            long counted = 0;
            long ai = 0;
            for (FileRecord file : contributingFiles.values()) {
                counted += file.countedLines();
                ai += file.aiLines();
            }
            if (counted > 0) {
                return ai * 100.0 / counted;
            }
            if (commitCount > 0) {
                return aiCommitCount * 100.0 / commitCount;
            }
            return 0.0;
        }

        ReviewStatus reviewStatus() {
            if (tests.isEmpty()) {
                return ReviewStatus.NO_TESTS;
            }
            if (aiInvolved) {
                return allReviewed ? ReviewStatus.REVIEWED : ReviewStatus.NEEDS_REVIEW;
            }
            return ReviewStatus.COMPLETE;
        }
    }
}
