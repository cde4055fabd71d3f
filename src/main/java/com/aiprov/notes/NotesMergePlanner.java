package com.aiprov.notes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Three-way comparison of note maps keyed by commit id. Values only need a
 * meaningful {@code equals}; for git they are the note blob ids.
 */
public final class NotesMergePlanner {
    private NotesMergePlanner() {
    }

    public static <V> NotesMergePlan plan(Map<String, V> base, Map<String, V> ours, Map<String, V> theirs) {
        Set<String> commits = new TreeSet<>();
        commits.addAll(ours.keySet());
        commits.addAll(theirs.keySet());

        List<String> keep = new ArrayList<>();
        List<String> takeTheirs = new ArrayList<>();
        List<String> drop = new ArrayList<>();
        List<String> conflicts = new ArrayList<>();

        for (String commit : commits) {
            V baseValue = base.get(commit);
            V ourValue = ours.get(commit);
            V theirValue = theirs.get(commit);

            if (Objects.equals(ourValue, theirValue)) {
                if (ourValue != null) {
                    keep.add(commit);
                }
            } else if (Objects.equals(ourValue, baseValue)) {
                if (theirValue == null) {
                    drop.add(commit);
                } else {
                    takeTheirs.add(commit);
                }
            } else if (Objects.equals(theirValue, baseValue)) {
                if (ourValue != null) {
                    keep.add(commit);
                }
            } else {
                conflicts.add(commit);
            }
        }
        return new NotesMergePlan(keep, takeTheirs, drop, conflicts);
    }
}
