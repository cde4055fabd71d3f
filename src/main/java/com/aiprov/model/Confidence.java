package com.aiprov.model;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence {
    HIGH("high"),
    MEDIUM("med"),
    // AI-assisted, mostly human-written
    LOW("low");

    private final String code;

    Confidence(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Optional<Confidence> parse(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String trimmed = code.strip();
        for (Confidence confidence : values()) {
            if (confidence.code.equals(trimmed)) {
                return Optional.of(confidence);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Confidence fromCode(String code) {
        return parse(code).orElseThrow(() -> new IllegalArgumentException(
                "Unknown confidence '" + code + "', expected one of high, med, low"));
    }

    @Override
    public String toString() {
        return code;
    }
}
