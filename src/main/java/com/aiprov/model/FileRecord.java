package com.aiprov.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FileRecord(
        String path,
        String revision,
        List<Block> blocks,
        Tag fileTag) {

    public FileRecord {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(revision, "revision");
        blocks = List.copyOf(blocks);
        int previousEnd = 0;
        for (Block block : blocks) {
            if (block.startLine() <= previousEnd) {
                throw new IllegalArgumentException(path + ": block " + block.startLine() + "-" + block.endLine()
                        + " overlaps or precedes line " + previousEnd);
            }
            previousEnd = block.endLine();
        }
    }

    @JsonProperty("lineCount")
    public int lineCount() {
        return blocks.isEmpty() ? 0 : blocks.get(blocks.size() - 1).endLine();
    }

    @JsonProperty("countedLines")
    public int countedLines() {
        return blocks.stream().mapToInt(Block::countedLines).sum();
    }

    @JsonProperty("aiLines")
    public int aiLines() {
        return blocks.stream().filter(Block::isAi).mapToInt(Block::countedLines).sum();
    }

    @JsonProperty("aiPercentage")
    public Double aiPercentage() {
        if (blocks.isEmpty()) {
            return 0.0;
        }
        int counted = countedLines();
        if (counted == 0) {
            return null;
        }
        return aiLines() * 100.0 / counted;
    }

    public List<Block> aiBlocks() {
        return blocks.stream().filter(Block::isAi).toList();
    }

    public List<Tag> tags() {
        List<Tag> tags = new ArrayList<>();
        for (Block block : blocks) {
            if (block.tag() != null) {
                tags.add(block.tag());
            }
        }
        return tags;
    }

    public List<String> traceIds() {
        Set<String> ids = new LinkedHashSet<>();
        tags().forEach(tag -> ids.addAll(tag.trace()));
        return List.copyOf(ids);
    }

    public List<String> testIds() {
        Set<String> ids = new LinkedHashSet<>();
        tags().forEach(tag -> ids.addAll(tag.tests()));
        return List.copyOf(ids);
    }
}
