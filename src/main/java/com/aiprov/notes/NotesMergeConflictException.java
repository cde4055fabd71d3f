package com.aiprov.notes;

import java.util.List;

import com.aiprov.git.RepositoryException;

public class NotesMergeConflictException extends RepositoryException {
    private final String otherRef;
    private final List<String> commitIds;

    public NotesMergeConflictException(String otherRef, List<String> commitIds) {
        super("Notes for " + commitIds.size() + " commit(s) were changed on both sides of the merge with "
                + otherRef + " and need manual resolution: " + String.join(", ", commitIds));
        this.otherRef = otherRef;
        this.commitIds = List.copyOf(commitIds);
    }

    public String otherRef() {
        return otherRef;
    }

    public List<String> commitIds() {
        return commitIds;
    }
}
