package com.aiprov.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Block(
        BlockKind kind,
        String name,
        int startLine,
        int endLine,
        int countedLines,
        Tag tag) {

    public Block {
        Objects.requireNonNull(kind, "kind");
        name = Identifiers.blankToNull(name);
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + "-" + endLine);
        }
        if (countedLines < 0 || countedLines > endLine - startLine + 1) {
            throw new IllegalArgumentException("countedLines " + countedLines + " outside range " + startLine + "-" + endLine);
        }
    }

    public static Block untagged(int startLine, int endLine, int countedLines) {
        return new Block(BlockKind.GENERIC, null, startLine, endLine, countedLines, null);
    }

    @JsonProperty("ai")
    public boolean isAi() {
        return tag != null;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
}
