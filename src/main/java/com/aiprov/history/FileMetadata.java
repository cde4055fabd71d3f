package com.aiprov.history;

import java.time.Instant;
import java.util.List;

import com.aiprov.model.AiTool;
import com.aiprov.model.BlockKind;
import com.aiprov.model.Confidence;
import com.aiprov.notes.LenientInstantDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * File-level provenance kept next to a file as {@code <path>.meta.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileMetadata(
        @JsonProperty("file") String file,
        @JsonProperty("generated_at") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant generatedAt,
        @JsonProperty("ai_tool") AiTool aiTool,
        @JsonProperty("confidence") Confidence confidence,
        @JsonProperty("trace") List<String> trace,
        @JsonProperty("tests") List<String> tests,
        @JsonProperty("reviewed_by") String reviewedBy,
        @JsonProperty("reviewed_at") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant reviewedAt,
        @JsonProperty("blocks") List<BlockMetadata> blocks) {

    public static final String SUFFIX = ".meta.json";

    public FileMetadata {
        trace = trace == null ? List.of() : List.copyOf(trace);
        tests = tests == null ? List.of() : List.copyOf(tests);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static String sidecarPath(String path) {
        return path + SUFFIX;
    }

    public static boolean isSidecar(String path) {
        return path.endsWith(SUFFIX);
    }

    @JsonProperty("ai_percentage")
    public double aiPercentage() {
        long total = 0;
        long ai = 0;
        for (BlockMetadata block : blocks) {
            int span = block.endLine() - block.startLine() + 1;
            total += span;
            if (block.ai()) {
                ai += span;
            }
        }
        return total == 0 ? 0.0 : ai * 100.0 / total;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BlockMetadata(
            @JsonProperty("kind") BlockKind kind,
            @JsonProperty("name") String name,
            @JsonProperty("lines") List<Integer> lines,
            @JsonProperty("ai") boolean ai,
            @JsonProperty("confidence") Confidence confidence,
            @JsonProperty("trace") String trace,
            @JsonProperty("tests") List<String> tests) {

        public BlockMetadata {
            if (lines == null || lines.size() != 2 || lines.contains(null)) {
                throw new IllegalArgumentException("lines must be [start, end]");
            }
            if (lines.get(0) < 1 || lines.get(1) < lines.get(0)) {
                throw new IllegalArgumentException("Invalid line range " + lines);
            }
            lines = List.copyOf(lines);
            tests = tests == null ? List.of() : List.copyOf(tests);
        }

        public int startLine() {
            return lines.get(0);
        }

        public int endLine() {
            return lines.get(1);
        }
    }
}
