package io.gamestate.core.observe;

import io.gamestate.core.protocol.Diff;
import io.gamestate.core.protocol.DiffEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObserverRegistryTest {

    private static Diff diff(DiffEntry... entries) {
        return Diff.of(List.of(entries));
    }

    @Test
    void deliversNewOldAndConcretePath() {
        ObserverRegistry registry = new ObserverRegistry();
        List<Object[]> calls = new ArrayList<>();
        registry.observe("party.*.hp", (now, before, ctx) -> calls.add(new Object[] {now, before, ctx}));

        Diff d = diff(new DiffEntry("party.0.hp", 20, 15), new DiffEntry("turn", 1, 2), new DiffEntry("party.1.hp", 15, 8));
        assertEquals(0, registry.notify(d));

        assertEquals(2, calls.size());
        assertEquals(15, calls.get(0)[0]);
        assertEquals(20, calls.get(0)[1]);
        assertEquals(new ObserverContext("party.0.hp", d), calls.get(0)[2]);
        assertEquals("party.1.hp", ((ObserverContext) calls.get(1)[2]).path());
        assertSame(d, ((ObserverContext) calls.get(1)[2]).diff());
    }

    @Test
    void firesInRegistrationOrder() {
        ObserverRegistry registry = new ObserverRegistry();
        List<String> order = new ArrayList<>();
        registry.observe("turn", (n, o, c) -> order.add("first"));
        registry.observe("*", (n, o, c) -> order.add("second"));
        registry.observe("turn", (n, o, c) -> order.add("third"));

        registry.notify(diff(new DiffEntry("turn", 1, 2)));
        assertEquals(List.of("first", "second", "third"), order);
    }

    @Test
    void unsubscribeIsIdempotent() {
        ObserverRegistry registry = new ObserverRegistry();
        List<String> seen = new ArrayList<>();
        Unsubscribe a = registry.observe("turn", (n, o, c) -> seen.add("a"));
        registry.observe("turn", (n, o, c) -> seen.add("b"));
        assertEquals(2, registry.size());

        a.unsubscribe();
        a.unsubscribe();
        assertEquals(1, registry.size());

        registry.notify(diff(new DiffEntry("turn", 1, 2)));
        assertEquals(List.of("b"), seen);
    }

    @Test
    void unsubscribingDuringNotificationStopsDelivery() {
        ObserverRegistry registry = new ObserverRegistry();
        List<String> seen = new ArrayList<>();
        Unsubscribe[] late = new Unsubscribe[1];
        registry.observe("*", (n, o, c) -> {
            seen.add("a:" + c.path());
            late[0].unsubscribe();
        });
        late[0] = registry.observe("*", (n, o, c) -> seen.add("b:" + c.path()));

        registry.notify(diff(new DiffEntry("x", 1, 2), new DiffEntry("y", 1, 2)));
        assertEquals(List.of("a:x", "a:y"), seen);
    }

    @Test
    void subscriptionAddedDuringNotificationStartsWithNextEntry() {
        ObserverRegistry registry = new ObserverRegistry();
        List<String> seen = new ArrayList<>();
        registry.observe("x", (n, o, c) -> registry.observe("*", (n2, o2, c2) -> seen.add(c2.path())));

        registry.notify(diff(new DiffEntry("x", 1, 2), new DiffEntry("y", 1, 2)));
        assertEquals(List.of("y"), seen);
    }

    @Test
    void failingObserverDoesNotStopOthers() {
        ObserverRegistry registry = new ObserverRegistry();
        List<String> seen = new ArrayList<>();
        registry.observe("turn", (n, o, c) -> { throw new IllegalStateException("observer bug"); });
        registry.observe("turn", (n, o, c) -> seen.add("ok"));

        assertEquals(1, registry.notify(diff(new DiffEntry("turn", 1, 2))));
        assertEquals(List.of("ok"), seen);
    }

    @Test
    void clearRemovesEverything() {
        ObserverRegistry registry = new ObserverRegistry();
        List<String> seen = new ArrayList<>();
        Unsubscribe handle = registry.observe("turn", (n, o, c) -> seen.add("a"));
        registry.clear();
        assertEquals(0, registry.size());
        handle.unsubscribe();

        registry.notify(diff(new DiffEntry("turn", 1, 2)));
        assertTrue(seen.isEmpty());
    }

    @Test
    void rejectsNullCallback() {
        assertThrows(NullPointerException.class, () -> new ObserverRegistry().observe("a", null));
    }
}
