package com.aiprov.notes;

import com.aiprov.git.RepositoryException;

public class WriteConflictException extends RepositoryException {
    private final String commitId;
    private final String notesRef;
    private final int attempts;

    public WriteConflictException(String commitId, String notesRef, int attempts) {
        super("Notes ref " + notesRef + " moved concurrently; gave up writing note for " + commitId
                + " after " + attempts + " attempt(s)");
        this.commitId = commitId;
        this.notesRef = notesRef;
        this.attempts = attempts;
    }

    public String commitId() {
        return commitId;
    }

    public String notesRef() {
        return notesRef;
    }

    public int attempts() {
        return attempts;
    }
}
