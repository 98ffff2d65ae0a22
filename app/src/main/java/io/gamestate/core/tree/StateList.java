package io.gamestate.core.tree;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.RandomAccess;
import java.util.function.Predicate;

/**
 * Immutable sequence node of a state tree.
 * The pseudo-key {@code length} reads the element count.
 */
public final class StateList extends AbstractList<Object> implements Container, RandomAccess {

    public static final String LENGTH = "length";

    private static final StateList EMPTY = new StateList(new Object[0]);

    private final Object[] items;

    // caller hands over ownership; items must already be frozen
    StateList(Object[] items) {
        this.items = items;
    }

    public static StateList empty() { return EMPTY; }

    /** Deep-frozen copy of {@code source} (identity if it already is a StateList). */
    public static StateList of(Collection<?> source) {
        return (StateList) StateTrees.freeze(source);
    }

    public static StateList of(Object... items) {
        return of(Arrays.asList(items));
    }

    @Override
    public Object get(int index) { return items[index]; }

    @Override
    public int size() { return items.length; }

    @Override
    public boolean isSequence() { return true; }

    @Override
    public Object child(Path.Segment segment) {
        if (segment.isIndex()) {
            return segment.index() < items.length ? items[segment.index()] : null;
        }
        if (LENGTH.equals(segment.text())) {
            return items.length;
        }
        return null;
    }

    @Override
    public StateList withChild(Path.Segment segment, Object value) {
        if (!segment.isIndex()) {
            throw new IllegalArgumentException("Expected a sequence index, got \"" + segment.text() + "\"");
        }
        return with(segment.index(), value);
    }

    /** Copy with {@code index} replaced; {@code index == size()} appends. */
    public StateList with(int index, Object value) {
        if (index == items.length) {
            return append(value);
        }
        if (index < 0 || index > items.length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for sequence of length " + items.length);
        }
        if (items[index] == value) {
            return this;
        }
        Object[] copy = items.clone();
        copy[index] = value;
        return new StateList(copy);
    }

    public StateList append(Object value) {
        Object[] copy = Arrays.copyOf(items, items.length + 1);
        copy[items.length] = value;
        return new StateList(copy);
    }

    /** Copy keeping only the items for which {@code remove} is false. */
    public StateList without(Predicate<Object> remove) {
        List<Object> kept = new ArrayList<>(items.length);
        for (Object item : items) {
            if (!remove.test(item)) {
                kept.add(item);
            }
        }
        if (kept.size() == items.length) {
            return this;
        }
        return new StateList(kept.toArray());
    }
}
