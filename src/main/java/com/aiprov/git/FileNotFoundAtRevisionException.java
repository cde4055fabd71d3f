package com.aiprov.git;

public class FileNotFoundAtRevisionException extends RepositoryException {
    private final String path;
    private final String revision;

    public FileNotFoundAtRevisionException(String path, String revision) {
        super("File not found at revision " + revision + ": " + path);
        this.path = path;
        this.revision = revision;
    }

    public String path() {
        return path;
    }

    public String revision() {
        return revision;
    }
}
