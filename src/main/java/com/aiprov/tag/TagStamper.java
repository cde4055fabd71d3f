package com.aiprov.tag;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiprov.model.Tag;

public class TagStamper {
    private static final Logger log = LoggerFactory.getLogger(TagStamper.class);

    public enum Position {
        TOP,
        BOTTOM
    }

    private final TagParser tagParser;

    public TagStamper(TagParser tagParser) {
        this.tagParser = tagParser;
    }

    public void stamp(Path file, Tag tag, Position position) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("File not found: " + file);
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        String updated = render(file.getFileName().toString(), content, tag, position);
        Files.writeString(file, updated, StandardCharsets.UTF_8);
        log.info("Stamped tag file={} tag='{}'", file, tag.format());
    }

    public String render(String path, String content, Tag tag, Position position) {
        CommentStyle style = tagParser.registry().styleFor(path);
        String tagLine = style.wrap(tag.format());
        String lineSeparator = content.contains("\r\n") ? "\r\n" : "\n";
        boolean trailingNewline = content.endsWith("\n");
        List<String> lines = new ArrayList<>(TextLines.split(content));

        int existing = fileLevelTagLine(lines, style);
        if (existing >= 0) {
            String indent = leadingWhitespace(lines.get(existing));
            lines.set(existing, indent + tagLine);
        } else if (position == Position.BOTTOM) {
            while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
                lines.remove(lines.size() - 1);
            }
            if (!lines.isEmpty()) {
                lines.add("");
            }
            lines.add(tagLine);
            trailingNewline = true;
        } else {
            lines.add(insertionPoint(lines), tagLine);
        }

        String joined = String.join(lineSeparator, lines);
        return trailingNewline || content.isEmpty() ? joined + lineSeparator : joined;
    }

    private int fileLevelTagLine(List<String> lines, CommentStyle style) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || line.startsWith("#!")) {
                continue;
            }
            if (!style.isCommentLine(line)) {
                return -1;
            }
            if (tagParser.isClosingMarker(line, style)) {
                continue;
            }
            if (style.commentBody(line).map(body -> body.startsWith(Tag.MARKER)).orElse(false)) {
                return i;
            }
        }
        return -1;
    }

    private static int insertionPoint(List<String> lines) {
        int position = 0;
        if (position < lines.size() && lines.get(position).startsWith("#!")) {
            position++;
        }
        if (position < lines.size() && isEncodingDeclaration(lines.get(position))) {
            position++;
        }
        return position;
    }

    private static boolean isEncodingDeclaration(String line) {
        return line.contains("coding:") || line.contains("coding=") || line.contains("encoding:");
    }

    private static String leadingWhitespace(String line) {
        int end = 0;
        while (end < line.length() && Character.isWhitespace(line.charAt(end))) {
            end++;
        }
        return line.substring(0, end);
    }
}
