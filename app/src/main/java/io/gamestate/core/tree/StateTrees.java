package io.gamestate.core.tree;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copy-on-write helpers over state trees.
 *
 * <p>Writes copy only the chain of containers from the root to the touched
 * node; every other subtree is reused by reference.
 */
public final class StateTrees {

    private StateTrees() {}

    /**
     * Deep read-only form of {@code value}. Frozen containers are returned as-is,
     * plain {@link Map}s, {@link Collection}s and arrays are copied.
     *
     * @throws IllegalArgumentException for null or unsupported leaf types
     */
    public static Object freeze(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("null is not a valid state value (use removeKey to delete)");
        }
        if (value instanceof StateMap || value instanceof StateList) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Mapping keys must be strings, got " + Values.typeName(e.getKey()));
                }
                copy.put(key, freeze(e.getValue()));
            }
            return copy.isEmpty() ? StateMap.empty() : new StateMap(copy);
        }
        if (value instanceof Collection<?> items) {
            Object[] copy = new Object[items.size()];
            int i = 0;
            for (Object item : items) {
                copy[i++] = freeze(item);
            }
            return copy.length == 0 ? StateList.empty() : new StateList(copy);
        }
        if (value instanceof Object[] array) {
            Object[] copy = new Object[array.length];
            for (int i = 0; i < array.length; i++) {
                copy[i] = freeze(array[i]);
            }
            return new StateList(copy);
        }
        if (!Values.isLeaf(value)) {
            throw new IllegalArgumentException("Unsupported state value type: " + value.getClass().getName());
        }
        return value;
    }

    /** The value as a container, or null for leaves and null. */
    public static Container asContainer(Object value) {
        return value instanceof Container container ? container : null;
    }

    /** Plain (wildcard-free) read; null as soon as traversal misses. */
    public static Object getIn(Object root, Path path) {
        Object current = root;
        for (Path.Segment segment : path.segments()) {
            Container container = asContainer(current);
            if (container == null) {
                return null;
            }
            current = container.child(segment);
        }
        return current;
    }

    /**
     * Copy of {@code root} with {@code value} stored at {@code path}.
     *
     * @throws IllegalStateException when an intermediate segment does not resolve to a container
     */
    public static Object setIn(Object root, Path path, Object value) {
        return setIn(root, path, 0, value);
    }

    private static Object setIn(Object node, Path path, int depth, Object value) {
        Path.Segment segment = path.segment(depth);
        Container container = asContainer(node);
        if (container == null) {
            if (depth == path.size() - 1) {
                throw new IllegalStateException("Cannot set \"" + segment + "\" on " + Values.typeName(node)
                        + " at path \"" + path + "\"");
            }
            throw new IllegalStateException("Cannot traverse into " + Values.typeName(node) + " at \"" + segment
                    + "\" of path \"" + path + "\"");
        }
        if (segment.isWildcard()) {
            throw new IllegalArgumentException("Wildcards are not allowed in mutation paths: \"" + path + "\"");
        }
        if (depth == path.size() - 1) {
            return container.withChild(segment, value);
        }
        Object next = setIn(container.child(segment), path, depth + 1, value);
        return container.withChild(segment, next);
    }
}
