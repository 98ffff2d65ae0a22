package io.gamestate.core.store;

import io.gamestate.core.tree.StateJson;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static io.gamestate.core.protocol.Mutations.removeKey;
import static io.gamestate.core.protocol.Mutations.set;
import static org.junit.jupiter.api.Assertions.*;

class ComponentIndexTest {

    private static GameStore newStore() {
        return GameStore.createStore(StateJson.fromJson(
                "{\"turn\": 1, \"entities\": {"
                        + "\"e1\": {\"pos\": {\"x\": 0, \"y\": 0}, \"hp\": 3},"
                        + "\"e2\": {\"pos\": {\"x\": 1, \"y\": 1}},"
                        + "\"e3\": 7}}"));
    }

    @Test
    void disabledIndexAnswersEmpty() {
        GameStore store = newStore();
        assertEquals(Set.of(), store.getEntitiesWithComponent("pos"));
    }

    @Test
    void indexesEntityKeys() {
        GameStore store = newStore();
        store.enableComponentIndex("entities");

        assertEquals(Set.of("e1", "e2"), store.getEntitiesWithComponent("pos"));
        assertEquals(Set.of("e1"), store.getEntitiesWithComponent("hp"));
        assertEquals(Set.of(), store.getEntitiesWithComponent("sprite"));
    }

    @Test
    void followsCommittedChanges() {
        GameStore store = newStore();
        store.enableComponentIndex("entities");

        store.dispatch(set("entities.e2.hp", 5));
        assertEquals(Set.of("e1", "e2"), store.getEntitiesWithComponent("hp"));

        store.dispatch(removeKey("entities.e1.hp"));
        assertEquals(Set.of("e2"), store.getEntitiesWithComponent("hp"));

        store.dispatch(set("entities.e4", Map.of("sprite", "orc")));
        assertEquals(Set.of("e4"), store.getEntitiesWithComponent("sprite"));
    }

    @Test
    void rebuildsOnReplaceState() {
        GameStore store = newStore();
        store.enableComponentIndex("entities");

        store.replaceState(StateJson.fromJson("{\"entities\": {\"z\": {\"ai\": true}}}"));

        assertEquals(Set.of(), store.getEntitiesWithComponent("pos"));
        assertEquals(Set.of("z"), store.getEntitiesWithComponent("ai"));
    }

    @Test
    void rebuildsWhenAnAncestorIsRemovedOrReplaced() {
        GameStore store = GameStore.createStore(StateJson.fromJson(
                "{\"world\": {\"entities\": {\"e1\": {\"hp\": 3}}}}"));
        store.enableComponentIndex("world.entities");
        assertEquals(Set.of("e1"), store.getEntitiesWithComponent("hp"));

        store.dispatch(removeKey("world"));
        assertNull(store.get("world"));
        assertEquals(Set.of(), store.getEntitiesWithComponent("hp"));

        store.dispatch(set("world", StateJson.fromJson("{\"entities\": {\"e9\": {\"ai\": true}}}")));
        assertEquals(Set.of("e9"), store.getEntitiesWithComponent("ai"));
        assertEquals(Set.of(), store.getEntitiesWithComponent("hp"));
    }

    @Test
    void ignoresSiblingsWithASharedPrefix() {
        GameStore store = GameStore.createStore(StateJson.fromJson(
                "{\"entities\": {\"e1\": {\"hp\": 3}}, \"entitiesArchive\": {}}"));
        store.enableComponentIndex("entities");

        store.dispatch(set("entitiesArchive.old", Map.of("hp", 1)));

        assertEquals(Set.of("e1"), store.getEntitiesWithComponent("hp"));
    }

    @Test
    void returnedSetsAreSnapshots() {
        GameStore store = newStore();
        store.enableComponentIndex("entities");
        Set<String> before = store.getEntitiesWithComponent("hp");

        store.dispatch(set("entities.e2.hp", 1));

        assertEquals(Set.of("e1"), before);
        assertThrows(UnsupportedOperationException.class, () -> before.add("x"));
    }
}
