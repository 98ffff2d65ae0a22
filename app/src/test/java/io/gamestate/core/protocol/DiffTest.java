package io.gamestate.core.protocol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffTest {

    @Test
    void findsEntriesByPath() {
        Diff diff = Diff.of(List.of(new DiffEntry("turn", 1, 2), new DiffEntry("score", null, 100)));
        assertEquals(2, diff.size());
        assertEquals(List.of("turn", "score"), diff.paths());
        assertEquals(new DiffEntry("score", null, 100), diff.find("score").orElseThrow());
        assertTrue(diff.find("missing").isEmpty());
    }

    @Test
    void emptyDiffIsShared() {
        assertSame(Diff.empty(), Diff.of(List.of()));
        assertTrue(Diff.empty().isEmpty());
    }

    @Test
    void entriesAreReadOnly() {
        Diff diff = Diff.of(List.of(new DiffEntry("a", 1, 2)));
        assertThrows(UnsupportedOperationException.class, () -> diff.entries().add(new DiffEntry("b", 1, 2)));
    }
}
