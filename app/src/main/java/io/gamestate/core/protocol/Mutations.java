package io.gamestate.core.protocol;

import io.gamestate.core.tree.Path;
import io.gamestate.core.tree.StateJson;
import io.gamestate.core.tree.StateList;
import io.gamestate.core.tree.StateMap;
import io.gamestate.core.tree.StateTrees;
import io.gamestate.core.tree.Values;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Builders for the five mutation primitives. Building never touches state;
 * all type checks happen when the mutation is applied, so a bad mutation
 * surfaces as a failed transaction rather than an exception at the call site.
 */
public final class Mutations {

    private Mutations() {}

    /** Replace the value at {@code path}. */
    public static Mutation set(String path, Object value) {
        Path p = Path.parse(path);
        return new Mutation(MutationType.SET, path, "Set " + path + " to " + describe(value),
                state -> StateTrees.setIn(state, p, StateTrees.freeze(value)));
    }

    /** Replace the value at {@code path} with {@code fn(current)}; current is null when absent. */
    public static Mutation update(String path, UnaryOperator<Object> fn) {
        Objects.requireNonNull(fn, "fn");
        Path p = Path.parse(path);
        return new Mutation(MutationType.UPDATE, path, "Update " + path, state -> {
            Object current = StateTrees.getIn(state, p);
            return StateTrees.setIn(state, p, StateTrees.freeze(fn.apply(current)));
        });
    }

    /** Append {@code item} to the sequence at {@code path}. */
    public static Mutation push(String path, Object item) {
        Path p = Path.parse(path);
        return new Mutation(MutationType.PUSH, path, "Push item onto " + path, state -> {
            StateList list = requireSequence(state, p);
            return StateTrees.setIn(state, p, list.append(StateTrees.freeze(item)));
        });
    }

    /** Drop every item of the sequence at {@code path} for which {@code predicate} holds. */
    public static Mutation removeWhere(String path, Predicate<Object> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        Path p = Path.parse(path);
        return new Mutation(MutationType.REMOVE, path, "Remove matching items from " + path, state -> {
            StateList list = requireSequence(state, p);
            return StateTrees.setIn(state, p, list.without(predicate));
        });
    }

    /** Delete the last segment's key from its parent mapping (the root for one-segment paths). */
    public static Mutation removeKey(String path) {
        Path p = Path.parse(path);
        Path parentPath = p.parent();
        String key = p.last().text();
        String parentText = parentPath == null ? "root" : parentPath.text();
        return new Mutation(MutationType.REMOVE, path, "Remove key \"" + key + "\" from " + parentText, state -> {
            Object parent = parentPath == null ? state : StateTrees.getIn(state, parentPath);
            if (!(parent instanceof StateMap mapping)) {
                throw new IllegalStateException("Expected mapping at path \"" + parentText + "\", got "
                        + Values.typeName(parent));
            }
            StateMap updated = mapping.without(key);
            return parentPath == null ? updated : StateTrees.setIn(state, parentPath, updated);
        });
    }

    private static StateList requireSequence(Object state, Path path) {
        Object value = StateTrees.getIn(state, path);
        if (!(value instanceof StateList list)) {
            throw new IllegalStateException("Expected sequence at path \"" + path + "\", got " + Values.typeName(value));
        }
        return list;
    }

    private static String describe(Object value) {
        try {
            return StateJson.toJson(value);
        } catch (IllegalArgumentException e) {
            return String.valueOf(value);
        }
    }
}
