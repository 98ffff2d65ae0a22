package io.gamestate.core.query;

import io.gamestate.core.tree.Container;
import io.gamestate.core.tree.Path;
import io.gamestate.core.tree.StateList;
import io.gamestate.core.tree.StateMap;
import io.gamestate.core.tree.StateTrees;
import io.gamestate.core.tree.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Read side of the store: path resolution with {@code *} expansion, existence
 * checks and filtered queries. A missing path is never an error: reads yield
 * null, false or an empty list.
 */
public final class Queries {

    private Queries() {}

    /**
     * Value at {@code path}, or null. A {@code *} segment over a sequence
     * collects the remainder of the path from every element, in order; results
     * that are themselves sequences are flattened and missing ones are skipped.
     */
    public static Object get(Object tree, String path) {
        Path parsed = Path.parse(path);
        return resolve(tree == null ? null : StateTrees.freeze(tree), parsed, 0);
    }

    public static boolean has(Object tree, String path) {
        return get(tree, path) != null;
    }

    public static boolean has(Object tree, String path, Predicate<Object> predicate) {
        Object value = get(tree, path);
        if (value == null) {
            return false;
        }
        return predicate == null || predicate.test(value);
    }

    public static List<Object> query(Object tree, String path) {
        return query(tree, path, (Predicate<Object>) null);
    }

    /** Elements at {@code path} (a single value counts as one element) that pass {@code filter}. */
    public static List<Object> query(Object tree, String path, Predicate<Object> filter) {
        Object value = get(tree, path);
        if (value == null) {
            return List.of();
        }
        List<?> items = value instanceof StateList list ? list : List.of(value);
        if (filter == null) {
            return List.copyOf(items);
        }
        List<Object> out = new ArrayList<>();
        for (Object item : items) {
            if (filter.test(item)) {
                out.add(item);
            }
        }
        return List.copyOf(out);
    }

    /**
     * Field filter: every entry must match the element's field of the same name.
     * Predicate values are applied to the field (null when absent); other values
     * are compared with {@link Values#sameValue}. Non-mapping elements never match.
     */
    public static List<Object> query(Object tree, String path, Map<String, ?> fieldFilter) {
        Objects.requireNonNull(fieldFilter, "fieldFilter");
        return query(tree, path, fieldMatcher(fieldFilter));
    }

    static Predicate<Object> fieldMatcher(Map<String, ?> fieldFilter) {
        return item -> {
            if (!(item instanceof StateMap mapping)) {
                return false;
            }
            for (Map.Entry<String, ?> e : fieldFilter.entrySet()) {
                if (!fieldMatches(mapping.get(e.getKey()), e.getValue())) {
                    return false;
                }
            }
            return true;
        };
    }

    private static boolean fieldMatches(Object actual, Object expected) {
        if (expected instanceof Predicate<?> predicate) {
            return testUnchecked(predicate, actual);
        }
        return Values.sameValue(actual, expected);
    }

    // erased cast: a field predicate sees whatever value the field holds
    private static <T> boolean testUnchecked(Predicate<T> predicate, Object actual) {
        return predicate.test((T) actual);
    }

    private static Object resolve(Object node, Path path, int depth) {
        if (depth == path.size()) {
            return node;
        }
        Path.Segment segment = path.segment(depth);
        if (segment.isWildcard()) {
            if (!(node instanceof StateList sequence)) {
                return null;
            }
            if (depth == path.size() - 1) {
                return node;
            }
            List<Object> collected = new ArrayList<>();
            for (Object element : sequence) {
                Object result = resolve(element, path, depth + 1);
                if (result instanceof StateList nested) {
                    collected.addAll(nested);
                } else if (result != null) {
                    collected.add(result);
                }
            }
            return StateList.of(collected);
        }
        Container container = StateTrees.asContainer(node);
        if (container == null) {
            return null;
        }
        return resolve(container.child(segment), path, depth + 1);
    }
}
