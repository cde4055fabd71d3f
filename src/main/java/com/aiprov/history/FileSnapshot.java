package com.aiprov.history;

import com.aiprov.block.FileAnalysis;
import com.aiprov.model.FileRecord;

public record FileSnapshot(String path, String revision, String text, FileAnalysis analysis) {

    public FileRecord record() {
        return analysis.record();
    }
}
