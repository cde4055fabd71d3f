package com.aiprov.tag;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.model.AiTool;
import com.aiprov.model.Confidence;
import com.aiprov.model.Tag;

/**
 * Reads inline provenance tags of the form
 * {@code <prefix> ai:<tool>:<confidence> [| trace:<id>,...] [| test:<id>,...] [| reviewed:<date>:<reviewer>]}.
 * Matching is anchored at the comment prefix of the line; a prefix that
 * happens to open a line inside a string literal is indistinguishable from a
 * real comment.
 */
public class TagParser {
    private static final Logger log = LoggerFactory.getLogger(TagParser.class);

    public static final String CLOSING_MARKER = "ai:end";

    private final CommentStyleRegistry registry;

    public TagParser() {
        this(CommentStyleRegistry.defaults());
    }

    public TagParser(CommentStyleRegistry registry) {
        this.registry = registry;
    }

    public CommentStyleRegistry registry() {
        return registry;
    }

    public TagScan scan(String path, String text) {
        CommentStyle style = registry.styleFor(path);
        List<String> lines = TextLines.split(text);
        List<TagOccurrence> tags = new ArrayList<>();
        List<Integer> closingMarkers = new ArrayList<>();
        List<MalformedTagException> warnings = new ArrayList<>();

        for (int index = 0; index < lines.size(); index++) {
            int lineNumber = index + 1;
            String line = lines.get(index);
            if (isClosingMarker(line, style)) {
                closingMarkers.add(lineNumber);
                continue;
            }
            try {
                parseLine(path, lineNumber, line, style).ifPresent(tag -> tags.add(new TagOccurrence(lineNumber, tag)));
            } catch (MalformedTagException e) {
                log.warn("Skipping malformed tag path={} line={} reason={}", path, lineNumber, e.reason());
                warnings.add(e);
            }
        }
        return new TagScan(path, lines.size(), tags, closingMarkers, warnings);
    }

    public Optional<Tag> parseLine(String line, CommentStyle style) throws MalformedTagException {
        return parseLine(null, 0, line, style);
    }

    public Optional<Tag> parseLine(String path, int lineNumber, String line, CommentStyle style) throws MalformedTagException {
        Optional<String> body = style.commentBody(line);
        if (body.isEmpty() || !body.get().startsWith(Tag.MARKER) || body.get().equals(CLOSING_MARKER)) {
            return Optional.empty();
        }
        return Optional.of(parseBody(path, lineNumber, line, body.get()));
    }

    public boolean isClosingMarker(String line, CommentStyle style) {
        return style.commentBody(line).map(CLOSING_MARKER::equals).orElse(false);
    }

    /**
     * Parses the canonical tag text produced by {@link Tag#format()}, without a
     * comment prefix.
     */
    public static Tag parse(String tagText) throws MalformedTagException {
        String body = tagText.strip();
        if (!body.startsWith(Tag.MARKER)) {
            throw new MalformedTagException(null, 0, tagText, "tag must start with '" + Tag.MARKER + "'");
        }
        return parseBody(null, 0, tagText, body);
    }

    private static Tag parseBody(String path, int lineNumber, String rawLine, String body) throws MalformedTagException {
        String[] fields = body.split("\\|", -1);
        String[] head = fields[0].strip().split(":", -1);
        if (head.length != 3) {
            throw new MalformedTagException(path, lineNumber, rawLine, "expected ai:<tool>:<confidence>");
        }
        String toolId = head[1].strip();
        String confidenceCode = head[2].strip();
        if (toolId.isEmpty()) {
            throw new MalformedTagException(path, lineNumber, rawLine, "empty tool");
        }
        if (confidenceCode.isEmpty()) {
            throw new MalformedTagException(path, lineNumber, rawLine, "empty confidence");
        }
        Confidence confidence = Confidence.parse(confidenceCode)
                .orElseThrow(() -> new MalformedTagException(path, lineNumber, rawLine,
                        "unknown confidence '" + confidenceCode + "'"));

        List<String> trace = new ArrayList<>();
        List<String> tests = new ArrayList<>();
        String reviewer = null;
        LocalDate reviewedAt = null;

        for (int i = 1; i < fields.length; i++) {
            String field = fields[i].strip();
            int colon = field.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = field.substring(0, colon).strip();
            String value = field.substring(colon + 1).strip();
            switch (key) {
                case "trace" -> trace.addAll(splitIds(value));
                case "test" -> tests.addAll(splitIds(value));
                case "reviewed" -> {
                    int separator = value.indexOf(':');
                    if (separator < 0) {
                        throw new MalformedTagException(path, lineNumber, rawLine, "expected reviewed:<date>:<reviewer>");
                    }
                    try {
                        reviewedAt = LocalDate.parse(value.substring(0, separator).strip());
                    } catch (DateTimeParseException e) {
                        throw new MalformedTagException(path, lineNumber, rawLine, "invalid review date '" + value.substring(0, separator) + "'");
                    }
                    reviewer = value.substring(separator + 1).strip();
                    if (reviewer.isEmpty()) {
                        throw new MalformedTagException(path, lineNumber, rawLine, "empty reviewer");
                    }
                }
                default -> {
                    // forward compatible: fields added by newer writers are ignored
                }
            }
        }

        try {
            return new Tag(AiTool.of(toolId), confidence, trace, tests, reviewer, reviewedAt);
        } catch (IllegalArgumentException e) {
            throw new MalformedTagException(path, lineNumber, rawLine, e.getMessage());
        }
    }

    private static List<String> splitIds(String value) {
        return Arrays.stream(value.split(","))
                .map(String::strip)
                .filter(id -> !id.isEmpty())
                .toList();
    }
}
