package com.aiprov.tag;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record CommentStyle(String languageId, List<String> prefixes) {
    private static final Map<String, String> CLOSERS = Map.of(
            "/*", "*/",
            "(*", "*)",
            "<!--", "-->",
            "{-", "-}");

    public CommentStyle {
        Objects.requireNonNull(languageId, "languageId");
        prefixes = prefixes.stream()
                .filter(prefix -> prefix != null && !prefix.isBlank())
                .map(String::strip)
                .distinct()
                .toList();
        if (prefixes.isEmpty()) {
            throw new IllegalArgumentException("Comment style '" + languageId + "' needs at least one prefix");
        }
    }

    public String primaryPrefix() {
        return prefixes.get(0);
    }

    /**
     * Text after the comment prefix when the line, ignoring leading
     * whitespace, starts with one of the prefixes. Further prefix characters
     * right after the match ({@code /**}, {@code ///}, {@code ---}) are part of
     * the prefix. A trailing block-comment closer on the same line is removed.
     */
    public Optional<String> commentBody(String line) {
        String trimmed = line.stripLeading();
        Optional<String> matched = prefixes.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .filter(trimmed::startsWith)
                .findFirst();
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        String body = trimmed.substring(matched.get().length());
        int start = 0;
        while (start < body.length() && isPrefixCharacter(body.charAt(start))) {
            start++;
        }
        body = body.substring(start).strip();
        for (String closer : CLOSERS.values()) {
            if (body.endsWith(closer)) {
                body = body.substring(0, body.length() - closer.length()).strip();
                break;
            }
        }
        return Optional.of(body);
    }

    private boolean isPrefixCharacter(char c) {
        if (Character.isLetterOrDigit(c) || Character.isWhitespace(c)) {
            return false;
        }
        for (String prefix : prefixes) {
            if (prefix.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    public boolean isCommentLine(String line) {
        return commentBody(line).isPresent();
    }

    public String wrap(String body) {
        String prefix = primaryPrefix();
        String closer = CLOSERS.get(prefix);
        if (closer != null) {
            return prefix + " " + body + " " + closer;
        }
        return prefix + " " + body;
    }
}
