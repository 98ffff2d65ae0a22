package io.gamestate.core.query;

import io.gamestate.core.tree.StateJson;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static io.gamestate.core.query.Filters.*;
import static org.junit.jupiter.api.Assertions.*;

class FiltersTest {

    @Test
    void orderingFilters() {
        assertTrue(lt(10).test(8));
        assertFalse(lt(10).test(10));
        assertTrue(lte(10).test(10));
        assertTrue(gt(1).test(1.5));
        assertTrue(gte(2L).test(2));
        assertTrue(lt(10).test(9L));
    }

    @Test
    void orderingFiltersRejectNonNumbers() {
        assertFalse(lt(10).test("5"));
        assertFalse(gt(0).test(null));
        assertFalse(gt(0).test(Double.NaN));
        assertFalse(lt(Double.NaN).test(1));
    }

    @Test
    void equalityFilters() {
        assertTrue(eq(1).test(1L));
        assertTrue(eq("bob").test("bob"));
        assertFalse(eq("bob").test("alice"));
        assertTrue(neq("bob").test("alice"));
        assertTrue(neq(1).test(null));
        assertTrue(oneOf("mage", "rogue").test("rogue"));
        assertFalse(oneOf("mage", "rogue").test("knight"));
        assertFalse(oneOf().test("x"));
    }

    @Test
    void withinMeasuresEuclideanDistance() {
        Predicate<Object> near = within(new Vec2(0, 0), 5);
        assertTrue(near.test(new Vec2(3, 4)));
        assertTrue(near.test(StateJson.fromJson("{\"x\": 3, \"y\": 4}")));
        assertFalse(near.test(Map.of("x", 4, "y", 4)));
        assertFalse(near.test(Map.of("x", "a", "y", 0)));
        assertFalse(near.test(7));
    }

    @Test
    void emptyCombinators() {
        assertTrue(allOf().test("anything"));
        assertFalse(anyOf().test("anything"));
    }

    @Test
    void combinatorsObeyBooleanLaws() {
        List<Predicate<Object>> predicates = List.of(
                lt(10), gt(3), eq(5), neq(7), oneOf(1, 2, 3), v -> v instanceof String, not(eq("a")));
        List<Object> values = new ArrayList<>(Arrays.asList(-1, 0, 1, 3, 5, 7, 9.5, 10, 11L, "a", "b", true));
        values.add(null);

        for (Predicate<Object> p : predicates) {
            for (Object v : values) {
                assertEquals(p.test(v), not(not(p)).test(v), "double negation at " + v);
                for (Predicate<Object> q : predicates) {
                    assertEquals(p.test(v) && q.test(v), allOf(p, q).test(v), "allOf at " + v);
                    assertEquals(p.test(v) || q.test(v), anyOf(p, q).test(v), "anyOf at " + v);
                    assertEquals(!(p.test(v) && q.test(v)), anyOf(not(p), not(q)).test(v), "De Morgan at " + v);
                }
            }
        }
    }
}
