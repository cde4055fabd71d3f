package com.aiprov.history;

import java.util.List;

import com.aiprov.block.BlockResolutionException;
import com.aiprov.block.FileAnalysis;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.FileRecord;
import com.aiprov.tag.MalformedTagException;

public record RepositoryScan(
        String revision,
        List<FileAnalysis> files,
        List<CommitRecord> commits,
        List<BlockResolutionException> fileErrors,
        List<MalformedTagException> warnings) {

    public RepositoryScan {
        files = List.copyOf(files);
        commits = List.copyOf(commits);
        fileErrors = List.copyOf(fileErrors);
        warnings = List.copyOf(warnings);
    }

    public List<FileRecord> fileRecords() {
        return files.stream().map(FileAnalysis::record).toList();
    }
}
