package com.aiprov.tag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class CommentStyleRegistry {
    public static final String FALLBACK_LANGUAGE = "any";

    private final Map<String, CommentStyle> styles;
    private final Map<String, String> languageByExtension;
    private final Map<String, String> languageByFileName;
    private final CommentStyle fallback;

    CommentStyleRegistry(Map<String, CommentStyle> styles, Map<String, String> languageByExtension, Map<String, String> languageByFileName) {
        this.styles = Map.copyOf(styles);
        this.languageByExtension = Map.copyOf(languageByExtension);
        this.languageByFileName = Map.copyOf(languageByFileName);
        Set<String> allPrefixes = new LinkedHashSet<>();
        styles.values().forEach(style -> allPrefixes.addAll(style.prefixes()));
        this.fallback = new CommentStyle(FALLBACK_LANGUAGE, new ArrayList<>(allPrefixes));
    }

    public static CommentStyleRegistry defaults() {
        return builder().build();
    }

    public static Builder builder() {
        Builder builder = new Builder();
        builder.style("hash", List.of("#"), "py", "rb", "sh", "bash", "zsh", "yaml", "yml", "toml", "r", "ex", "exs", "pl", "ps1", "cfg", "conf");
        builder.style("c", List.of("//", "/*", "*"), "js", "ts", "jsx", "tsx", "mjs", "java", "c", "cpp", "cc", "h", "hpp",
                "cs", "go", "rs", "swift", "kt", "kts", "scala", "php", "groovy", "gradle", "dart");
        builder.style("dash", List.of("--"), "sql", "lua", "hs", "elm", "ada");
        builder.style("ml", List.of("(*"), "ml", "mli", "fs", "pas");
        builder.style("markup", List.of("<!--"), "html", "htm", "xml", "md", "markdown", "vue", "svg");
        builder.style("lisp", List.of(";"), "clj", "cljs", "lisp", "el", "scm", "asm", "ini");
        builder.style("percent", List.of("%"), "tex", "erl", "m");
        builder.fileName("Dockerfile", "hash");
        builder.fileName("Makefile", "hash");
        builder.fileName("CMakeLists.txt", "hash");
        return builder;
    }

    public CommentStyle styleFor(String path) {
        String fileName = fileName(path);
        String language = languageByFileName.get(fileName);
        if (language == null) {
            int dot = fileName.lastIndexOf('.');
            if (dot >= 0 && dot < fileName.length() - 1) {
                language = languageByExtension.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
            }
        }
        if (language == null) {
            return fallback;
        }
        return styles.getOrDefault(language, fallback);
    }

    public CommentStyle style(String languageId) {
        if (FALLBACK_LANGUAGE.equals(languageId)) {
            return fallback;
        }
        CommentStyle style = styles.get(languageId);
        if (style == null) {
            throw new IllegalArgumentException("Unknown comment style language: " + languageId);
        }
        return style;
    }

    public CommentStyle fallback() {
        return fallback;
    }

    private static String fileName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    public static final class Builder {
        private final Map<String, CommentStyle> styles = new LinkedHashMap<>();
        private final Map<String, String> languageByExtension = new LinkedHashMap<>();
        private final Map<String, String> languageByFileName = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder style(String languageId, List<String> prefixes, String... extensions) {
            styles.put(languageId, new CommentStyle(languageId, prefixes));
            for (String extension : extensions) {
                extension(extension, languageId);
            }
            return this;
        }

        public Builder extension(String extension, String languageId) {
            String normalized = extension.startsWith(".") ? extension.substring(1) : extension;
            languageByExtension.put(normalized.toLowerCase(Locale.ROOT), languageId);
            return this;
        }

        public Builder fileName(String fileName, String languageId) {
            languageByFileName.put(fileName, languageId);
            return this;
        }

        public CommentStyleRegistry build() {
            for (Map.Entry<String, String> entry : languageByExtension.entrySet()) {
                if (!styles.containsKey(entry.getValue())) {
                    throw new IllegalArgumentException("Extension '" + entry.getKey() + "' maps to unknown language '" + entry.getValue() + "'");
                }
            }
            return new CommentStyleRegistry(styles, languageByExtension, languageByFileName);
        }
    }
}
