package io.gamestate.core.store;

import io.gamestate.core.protocol.Diff;
import io.gamestate.core.protocol.DiffEntry;
import io.gamestate.core.query.Queries;
import io.gamestate.core.state.DiffEngine;
import io.gamestate.core.tree.StateMap;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Component name -> entity ids, over a mapping of entity id -> entity mapping
 * at a fixed collection path. Entities that are not mappings are ignored.
 */
final class ComponentIndex {
    private static final Logger LOG = Logger.getLogger(ComponentIndex.class.getName());

    private final Map<String, Set<String>> byComponent = new HashMap<>();
    private String collectionPath;

    void enable(String collectionPath, Object state) {
        this.collectionPath = collectionPath;
        rebuild(state);
    }

    /**
     * Rebuilds when the diff touches the collection, anything under it, or any
     * ancestor of it (an ancestor entry means the whole subtree was replaced or removed).
     */
    void onCommit(Diff diff, Object state) {
        if (collectionPath == null) {
            return;
        }
        for (DiffEntry e : diff.entries()) {
            if (touchesCollection(e.path())) {
                rebuild(state);
                return;
            }
        }
    }

    private boolean touchesCollection(String changed) {
        return changed.equals(collectionPath)
                || changed.equals(DiffEngine.ROOT)
                || changed.startsWith(collectionPath + ".")
                || collectionPath.startsWith(changed + ".");
    }

    void rebuild(Object state) {
        byComponent.clear();
        if (collectionPath == null) {
            return;
        }
        Object collection = Queries.get(state, collectionPath);
        if (!(collection instanceof StateMap entities)) {
            LOG.fine("Component index: no mapping at " + collectionPath);
            return;
        }
        for (Map.Entry<String, Object> entity : entities.entrySet()) {
            if (!(entity.getValue() instanceof StateMap components)) {
                continue;
            }
            for (String component : components.keySet()) {
                byComponent.computeIfAbsent(component, k -> new LinkedHashSet<>()).add(entity.getKey());
            }
        }
        LOG.fine("Component index rebuilt: " + byComponent.size() + " components under " + collectionPath);
    }

    Set<String> entitiesWith(String component) {
        Set<String> ids = byComponent.get(component);
        return ids == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }
}
