package com.aiprov.notes;

import com.aiprov.git.RepositoryException;

public class MalformedNoteException extends RepositoryException {
    private static final int EXCERPT_LENGTH = 120;

    private final String commitId;

    public MalformedNoteException(String commitId, String payload, Throwable cause) {
        super("Note for commit " + commitId + " is not a valid provenance record: " + excerpt(payload), cause);
        this.commitId = commitId;
    }

    public String commitId() {
        return commitId;
    }

    private static String excerpt(String payload) {
        if (payload == null) {
            return "<empty>";
        }
        String singleLine = payload.strip().replaceAll("\\s+", " ");
        return singleLine.length() <= EXCERPT_LENGTH ? singleLine : singleLine.substring(0, EXCERPT_LENGTH) + "...";
    }
}
