package io.gamestate.core.tree;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    void numbersCompareAcrossBoxedTypes() {
        assertTrue(Values.sameValue(1, 1L));
        assertTrue(Values.sameValue(1, 1.0));
        assertTrue(Values.sameValue(BigInteger.TEN, 10));
        assertFalse(Values.sameValue(1, 2));
        assertTrue(Values.compareNumbers(2, 2.5) < 0);
        assertTrue(Values.compareNumbers(Long.MAX_VALUE, Long.MAX_VALUE - 1) > 0);
    }

    @Test
    void nanEqualsNothing() {
        assertFalse(Values.sameValue(Double.NaN, Double.NaN));
    }

    @Test
    void nonNumbersUseEquals() {
        assertTrue(Values.sameValue("a", "a"));
        assertFalse(Values.sameValue("1", 1));
        assertTrue(Values.sameValue(null, null));
        assertFalse(Values.sameValue(null, 0));
    }

    @Test
    void typeNames() {
        assertEquals("undefined", Values.typeName(null));
        assertEquals("number", Values.typeName(3));
        assertEquals("sequence", Values.typeName(StateList.of(1)));
        assertEquals("mapping", Values.typeName(StateMap.empty()));
        assertEquals("string", Values.typeName("x"));
        assertEquals("boolean", Values.typeName(true));
    }
}
