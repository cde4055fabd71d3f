package com.aiprov.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public record AiTool(String id) {
    private static final Pattern ID_PATTERN = Pattern.compile("[a-z0-9][a-z0-9._+-]*");

    public static final AiTool CLAUDE = new AiTool("claude");
    public static final AiTool COPILOT = new AiTool("copilot");
    public static final AiTool CHATGPT = new AiTool("chatgpt");
    public static final AiTool GEMINI = new AiTool("gemini");
    public static final AiTool CURSOR = new AiTool("cursor");
    public static final AiTool OTHER = new AiTool("other");

    private static final List<AiTool> KNOWN = List.of(CLAUDE, COPILOT, CHATGPT, GEMINI, CURSOR, OTHER);

    public AiTool {
        Objects.requireNonNull(id, "id");
        id = id.strip().toLowerCase(Locale.ROOT);
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid AI tool id: '" + id + "'");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AiTool of(String id) {
        return new AiTool(id);
    }

    public static List<AiTool> known() {
        return KNOWN;
    }

    public boolean isKnown() {
        return KNOWN.contains(this);
    }

    @Override
    @JsonValue
    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
