package com.aiprov.tag;

import java.util.Objects;

import com.aiprov.model.Tag;

public record TagOccurrence(int lineNumber, Tag tag) {
    public TagOccurrence {
        Objects.requireNonNull(tag, "tag");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1: " + lineNumber);
        }
    }
}
