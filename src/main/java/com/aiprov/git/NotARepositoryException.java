package com.aiprov.git;

import java.nio.file.Path;

public class NotARepositoryException extends RepositoryException {
    private final Path directory;

    public NotARepositoryException(Path directory, String detail) {
        super("Not inside a git work tree: " + directory + (detail == null || detail.isBlank() ? "" : " (" + detail + ")"));
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }
}
