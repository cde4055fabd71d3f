package com.aiprov.notes;

import java.io.IOException;
import java.util.Optional;
import java.util.stream.Stream;

import com.aiprov.model.CommitRecord;

public interface NotesStore {
    String DEFAULT_REF = "refs/notes/ai-provenance";

    CommitRecord write(String commitId, CommitRecord record) throws IOException;

    Optional<CommitRecord> read(String commitId) throws IOException;

    /**
     * Records of commits in the given range, newest first. {@code since} and
     * {@code until} are revisions or ISO dates and may be null. The stream is
     * evaluated lazily against one snapshot of the ledger; calling again starts
     * over.
     */
    Stream<CommitRecord> list(String since, String until) throws IOException;

    boolean remove(String commitId, String reason) throws IOException;

    NotesMergePlan detectMerge(String otherRef) throws IOException;

    NotesMergePlan merge(String otherRef) throws IOException;
}
