package com.aiprov.block;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.aiprov.model.BlockKind;
import com.aiprov.tag.CommentStyle;

public class BlockKindDetector {
    private static final Pattern CLASS_PATTERN = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|internal|abstract|final|static|sealed|export|default|data|open|pub)\\s+)*"
                    + "(?:class|interface|struct|enum|trait|record|object)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
            "^(\\s*)(?:(?:public|private|protected|static|async|export|default|override|suspend|inline|pub|final|local)\\s+)*"
                    + "(?:def|fun|func|function|fn|sub)\\s+([A-Za-z_$][\\w$.:]*)");
    private static final Pattern METHOD_SIGNATURE_PATTERN = Pattern.compile(
            "^\\s+(?:(?:public|private|protected|static|final|synchronized|abstract|override|virtual|async)\\s+)+"
                    + "[\\w<>\\[\\],.?]+(?:\\s+[\\w<>\\[\\],.?]+)*?\\s+([A-Za-z_$][\\w$]*)\\s*\\(");

    public record Declaration(BlockKind kind, String name) {
    }

    public Optional<Declaration> detect(List<String> lines, int startLine, int endLine, CommentStyle style) {
        for (int lineNumber = startLine; lineNumber <= endLine && lineNumber <= lines.size(); lineNumber++) {
            String line = lines.get(lineNumber - 1);
            if (line.isBlank() || style.isCommentLine(line) || line.stripLeading().startsWith("@")) {
                continue;
            }
            return match(line);
        }
        return Optional.empty();
    }

    Optional<Declaration> match(String line) {
        Matcher classMatcher = CLASS_PATTERN.matcher(line);
        if (classMatcher.find()) {
            return Optional.of(new Declaration(BlockKind.CLASS, classMatcher.group(1)));
        }
        Matcher functionMatcher = FUNCTION_PATTERN.matcher(line);
        if (functionMatcher.find()) {
            BlockKind kind = functionMatcher.group(1).isEmpty() ? BlockKind.FUNCTION : BlockKind.METHOD;
            return Optional.of(new Declaration(kind, functionMatcher.group(2)));
        }
        Matcher methodMatcher = METHOD_SIGNATURE_PATTERN.matcher(line);
        if (methodMatcher.find()) {
            return Optional.of(new Declaration(BlockKind.METHOD, methodMatcher.group(1)));
        }
        return Optional.empty();
    }
}
