package io.gamestate.core.state;

import io.gamestate.core.protocol.Diff;
import io.gamestate.core.protocol.DiffEntry;
import io.gamestate.core.tree.Container;
import io.gamestate.core.tree.Path;
import io.gamestate.core.tree.StateList;
import io.gamestate.core.tree.StateMap;
import io.gamestate.core.tree.StateTrees;
import io.gamestate.core.tree.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural comparison of two state trees.
 *
 * <p>Entries come out in pre-order: a container's children are visited in
 * index/key order, keys that exist only in {@code after} follow the keys of
 * {@code before}, and a resized sequence adds a trailing {@code <path>.length}
 * entry after its element entries. A scalar root change is reported at {@code "root"}.
 */
public final class DiffEngine {

    public static final String ROOT = "root";

    private DiffEngine() {}

    public static Diff computeDiff(Object before, Object after) {
        List<DiffEntry> entries = new ArrayList<>();
        diff(freezeOrNull(before), freezeOrNull(after), "", entries);
        return Diff.of(entries);
    }

    private static void diff(Object before, Object after, String path, List<DiffEntry> out) {
        if (before == after) {
            return;
        }
        if (before instanceof StateList from && after instanceof StateList to) {
            diffSequences(from, to, path, out);
            return;
        }
        if (before instanceof StateMap from && after instanceof StateMap to) {
            diffMappings(from, to, path, out);
            return;
        }
        boolean containers = before instanceof Container || after instanceof Container;
        if (!containers && Values.sameValue(before, after)) {
            return;
        }
        out.add(new DiffEntry(path.isEmpty() ? ROOT : path, before, after));
    }

    private static void diffSequences(StateList before, StateList after, String path, List<DiffEntry> out) {
        int max = Math.max(before.size(), after.size());
        for (int i = 0; i < max; i++) {
            String child = Path.join(path, Integer.toString(i));
            if (i >= before.size()) {
                out.add(new DiffEntry(child, null, after.get(i)));
            } else if (i >= after.size()) {
                out.add(new DiffEntry(child, before.get(i), null));
            } else {
                diff(before.get(i), after.get(i), child, out);
            }
        }
        if (before.size() != after.size()) {
            out.add(new DiffEntry(Path.join(path, StateList.LENGTH), before.size(), after.size()));
        }
    }

    private static void diffMappings(StateMap before, StateMap after, String path, List<DiffEntry> out) {
        for (String key : before.keySet()) {
            String child = Path.join(path, key);
            if (!after.containsKey(key)) {
                out.add(new DiffEntry(child, before.get(key), null));
            } else {
                diff(before.get(key), after.get(key), child, out);
            }
        }
        for (String key : after.keySet()) {
            if (!before.containsKey(key)) {
                out.add(new DiffEntry(Path.join(path, key), null, after.get(key)));
            }
        }
    }

    private static Object freezeOrNull(Object value) {
        return value == null ? null : StateTrees.freeze(value);
    }
}
