package io.gamestate.core.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathTest {

    @Test
    void classifiesSegments() {
        Path path = Path.parse("party.0.*.hp");
        assertEquals(4, path.size());
        assertEquals(Path.Kind.KEY, path.segment(0).kind());
        assertEquals(Path.Kind.INDEX, path.segment(1).kind());
        assertEquals(0, path.segment(1).index());
        assertEquals(Path.Kind.WILDCARD, path.segment(2).kind());
        assertTrue(path.containsWildcard());
        assertEquals("hp", path.last().text());
    }

    @Test
    void onlyCanonicalIntegersAreIndices() {
        assertTrue(Path.Segment.of("12").isIndex());
        assertFalse(Path.Segment.of("012").isIndex());
        assertFalse(Path.Segment.of("-1").isIndex());
        assertFalse(Path.Segment.of("1a").isIndex());
        assertFalse(Path.Segment.of("").isIndex());
        assertFalse(Path.Segment.of("99999999999").isIndex());
    }

    @Test
    void parentDropsLastSegment() {
        Path path = Path.parse("player.buffs.shield");
        assertTrue(path.hasParent());
        assertEquals("player.buffs", path.parent().text());
        assertEquals(2, path.parent().size());
        assertNull(Path.parse("turn").parent());
    }

    @Test
    void joinBuildsChildPaths() {
        assertEquals("turn", Path.join("", "turn"));
        assertEquals("party.0", Path.join("party", "0"));
    }

    @Test
    void equalityIsTextual() {
        assertEquals(Path.parse("a.b"), Path.parse("a.b"));
        assertNotEquals(Path.parse("a.b"), Path.parse("a.c"));
    }
}
