package com.aiprov.block;

import java.util.List;

import com.aiprov.model.FileRecord;
import com.aiprov.tag.MalformedTagException;
import com.aiprov.tag.TagOccurrence;
import com.aiprov.tag.TagScan;

public record FileAnalysis(FileRecord record, TagScan scan) {

    public List<TagOccurrence> tags() {
        return scan.tags();
    }

    public List<MalformedTagException> warnings() {
        return scan.warnings();
    }
}
