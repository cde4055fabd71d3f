package com.aiprov.commit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.aiprov.model.AiTool;
import com.aiprov.model.Confidence;
import com.aiprov.model.Identifiers;

/**
 * Commit message convention for provenance-aware commits:
 *
 * <pre>
 * [AI:claude:high] feat(parser): support block comments
 *
 * Trace: SPEC-123, SPEC-456
 * Test: TC-789
 * Reviewed-by: AI+alice@example.com
 * </pre>
 *
 * @param reviewedBy reviewer identity without the {@code AI+} marker
 */
public record CommitMessage(
        String raw,
        AiTool tool,
        Confidence confidence,
        String conventionalType,
        String scope,
        String subject,
        List<String> trace,
        List<String> tests,
        String reviewedBy) {

    static final String REVIEWER_MARKER = "AI+";
    private static final Pattern AI_TAG = Pattern.compile("^\\[AI:([A-Za-z0-9][A-Za-z0-9._+-]*)(?::([^\\]]*))?]\\s*");
    private static final Pattern CONVENTIONAL = Pattern.compile("^([A-Za-z]+)(?:\\(([^)]*)\\))?!?:\\s*(.*)$");

    public CommitMessage {
        trace = List.copyOf(trace);
        tests = List.copyOf(tests);
    }

    public boolean hasAiTag() {
        return tool != null;
    }

    public static CommitMessage parse(String message) {
        String raw = message == null ? "" : message;
        List<String> lines = raw.strip().lines().toList();
        String firstLine = lines.isEmpty() ? "" : lines.get(0).strip();

        AiTool tool = null;
        Confidence confidence = null;
        Matcher aiTag = AI_TAG.matcher(firstLine);
        if (aiTag.find()) {
            tool = AiTool.of(aiTag.group(1));
            if (aiTag.group(2) != null) {
                confidence = Confidence.parse(aiTag.group(2).strip()).orElse(null);
            }
            firstLine = firstLine.substring(aiTag.end());
        }

        String conventionalType = null;
        String scope = null;
        String subject = firstLine;
        Matcher conventional = CONVENTIONAL.matcher(firstLine);
        if (conventional.matches()) {
            conventionalType = conventional.group(1);
            scope = Identifiers.blankToNull(conventional.group(2));
            subject = conventional.group(3).strip();
        }

        List<String> trace = new ArrayList<>();
        List<String> tests = new ArrayList<>();
        String reviewedBy = null;
        for (String line : lines.subList(Math.min(1, lines.size()), lines.size())) {
            String trimmed = line.strip();
            if (trimmed.startsWith("Trace:")) {
                trace.addAll(splitIds(trimmed.substring("Trace:".length())));
            } else if (trimmed.startsWith("Test:")) {
                tests.addAll(splitIds(trimmed.substring("Test:".length())));
            } else if (trimmed.startsWith("Reviewed-by:")) {
                String reviewer = trimmed.substring("Reviewed-by:".length()).strip();
                if (reviewer.startsWith(REVIEWER_MARKER)) {
                    reviewer = reviewer.substring(REVIEWER_MARKER.length());
                }
                reviewedBy = Identifiers.blankToNull(reviewer);
            }
        }
        return new CommitMessage(raw, tool, confidence, conventionalType, scope, subject,
                distinct(trace), distinct(tests), reviewedBy);
    }

    /**
     * Builds a message following the convention. A message that already starts
     * with an {@code [AI:} tag keeps it.
     */
    public static String compose(String message, AiTool tool, Confidence confidence,
            List<String> trace, List<String> tests, String reviewer) {
        String subject = message.strip();
        StringBuilder text = new StringBuilder();
        if (tool != null && !subject.startsWith("[AI:")) {
            Confidence level = confidence == null ? Confidence.MEDIUM : confidence;
            text.append("[AI:").append(tool.id()).append(':').append(level.code()).append("] ");
        }
        text.append(subject);

        List<String> footer = new ArrayList<>();
        if (trace != null && !trace.isEmpty()) {
            footer.add("Trace: " + String.join(", ", trace));
        }
        if (tests != null && !tests.isEmpty()) {
            footer.add("Test: " + String.join(", ", tests));
        }
        if (reviewer != null && !reviewer.isBlank()) {
            String reviewedBy = reviewer.startsWith(REVIEWER_MARKER) ? reviewer : REVIEWER_MARKER + reviewer;
            footer.add("Reviewed-by: " + reviewedBy);
        }
        if (!footer.isEmpty()) {
            text.append("\n\n").append(String.join("\n", footer));
        }
        return text.toString();
    }

    private static List<String> splitIds(String value) {
        return Arrays.stream(value.split(","))
                .map(String::strip)
                .filter(id -> !id.isEmpty())
                .toList();
    }

    private static List<String> distinct(List<String> ids) {
        return ids.stream().distinct().toList();
    }
}
