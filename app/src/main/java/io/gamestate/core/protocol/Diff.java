package io.gamestate.core.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Ordered list of changes between two state trees. */
public final class Diff {

    private static final Diff EMPTY = new Diff(List.of());

    private final List<DiffEntry> entries;

    private Diff(List<DiffEntry> entries) {
        this.entries = entries;
    }

    public static Diff empty() { return EMPTY; }

    public static Diff of(List<DiffEntry> entries) {
        return entries.isEmpty() ? EMPTY : new Diff(List.copyOf(entries));
    }

    public List<DiffEntry> entries() { return entries; }
    public boolean isEmpty() { return entries.isEmpty(); }
    public int size() { return entries.size(); }

    public Optional<DiffEntry> find(String path) {
        for (DiffEntry e : entries) {
            if (e.path().equals(path)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public List<String> paths() {
        List<String> out = new ArrayList<>(entries.size());
        for (DiffEntry e : entries) out.add(e.path());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diff other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() { return entries.hashCode(); }

    @Override
    public String toString() { return "Diff" + entries; }
}
