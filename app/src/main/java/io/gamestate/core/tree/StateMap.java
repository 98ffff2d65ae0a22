package io.gamestate.core.tree;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, insertion-ordered mapping node of a state tree.
 * Every mutator inherited from {@link Map} throws {@link UnsupportedOperationException}.
 */
public final class StateMap extends AbstractMap<String, Object> implements Container {

    private static final StateMap EMPTY = new StateMap(new LinkedHashMap<>());

    private final LinkedHashMap<String, Object> entries;
    private final Set<Entry<String, Object>> view;

    // caller hands over ownership; values must already be frozen
    StateMap(LinkedHashMap<String, Object> entries) {
        this.entries = entries;
        this.view = Collections.unmodifiableMap(entries).entrySet();
    }

    public static StateMap empty() { return EMPTY; }

    /** Deep-frozen copy of {@code source} (identity if it already is a StateMap). */
    public static StateMap of(Map<String, ?> source) {
        return (StateMap) StateTrees.freeze(source);
    }

    @Override
    public Set<Entry<String, Object>> entrySet() { return view; }

    @Override
    public Object get(Object key) { return entries.get(key); }

    @Override
    public boolean containsKey(Object key) { return entries.containsKey(key); }

    @Override
    public int size() { return entries.size(); }

    @Override
    public boolean isSequence() { return false; }

    @Override
    public Object child(Path.Segment segment) {
        if (segment.isWildcard()) {
            return null;
        }
        return entries.get(segment.text());
    }

    @Override
    public StateMap withChild(Path.Segment segment, Object value) {
        if (segment.isWildcard()) {
            throw new IllegalArgumentException("Wildcard cannot address a mapping entry for writing");
        }
        return with(segment.text(), value);
    }

    public StateMap with(String key, Object value) {
        if (entries.get(key) == value) {
            return this;
        }
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new StateMap(copy);
    }

    /** Copy without {@code key}; the receiver itself when the key is absent. */
    public StateMap without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(entries);
        copy.remove(key);
        return new StateMap(copy);
    }
}
