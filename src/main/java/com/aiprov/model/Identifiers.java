package com.aiprov.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class Identifiers {
    private Identifiers() {
    }

    public static List<String> distinct(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String id : ids) {
            if (id == null) {
                continue;
            }
            String trimmed = id.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.contains(",") || trimmed.contains("|") || trimmed.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Identifier must not contain ',', '|' or whitespace: '" + trimmed + "'");
            }
            seen.add(trimmed);
        }
        return List.copyOf(seen);
    }

    public static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.strip();
    }
}
