package com.aiprov.tag;

import java.util.List;

public record TagScan(
        String path,
        int lineCount,
        List<TagOccurrence> tags,
        List<Integer> closingMarkers,
        List<MalformedTagException> warnings) {

    public TagScan {
        tags = List.copyOf(tags);
        closingMarkers = List.copyOf(closingMarkers);
        warnings = List.copyOf(warnings);
    }
}
