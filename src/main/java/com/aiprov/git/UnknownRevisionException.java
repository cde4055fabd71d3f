package com.aiprov.git;

public class UnknownRevisionException extends RepositoryException {
    private final String revision;

    public UnknownRevisionException(String revision) {
        super("Revision cannot be resolved to a commit: " + revision);
        this.revision = revision;
    }

    public String revision() {
        return revision;
    }
}
