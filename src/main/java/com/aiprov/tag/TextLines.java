package com.aiprov.tag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class TextLines {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private TextLines() {
    }

    public static List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String content = text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
        List<String> lines = new ArrayList<>(Arrays.asList(content.split("\\R", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    public static boolean isBlank(String line) {
        return line == null || line.isBlank();
    }
}
