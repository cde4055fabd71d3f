package com.aiprov.history;

import java.util.List;

import com.aiprov.model.CommitRecord;
import com.aiprov.model.FileRecord;
import com.aiprov.tag.MalformedTagException;
import com.aiprov.tag.TagOccurrence;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record FileReport(
        String path,
        String revision,
        FileRecord record,
        List<TagOccurrence> tags,
        @JsonIgnore List<MalformedTagException> malformedTags,
        CommitRecord commit,
        FileMetadata metadata) {

    public FileReport {
        tags = List.copyOf(tags);
        malformedTags = List.copyOf(malformedTags);
    }

    @JsonProperty("warnings")
    public List<String> warnings() {
        return malformedTags.stream().map(Throwable::getMessage).toList();
    }
}
