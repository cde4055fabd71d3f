package com.aiprov.notes;

import java.util.List;

public record NotesMergePlan(
        List<String> keep,
        List<String> takeTheirs,
        List<String> drop,
        List<String> conflicts) {

    public NotesMergePlan {
        keep = List.copyOf(keep);
        takeTheirs = List.copyOf(takeTheirs);
        drop = List.copyOf(drop);
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public boolean changesOurs() {
        return !takeTheirs.isEmpty() || !drop.isEmpty();
    }
}
