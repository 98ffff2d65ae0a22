package io.gamestate.core.tree;

import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/** Leaf-level equality, ordering and type names. */
public final class Values {

    private Values() {}

    /**
     * Immutable scalars only: strings, booleans, characters, enums, the boxed
     * primitive and big-number types, and records whose components are all leaves.
     * Mutable numbers such as {@code AtomicInteger} or {@code LongAdder} are not leaves.
     */
    static boolean isLeaf(Object value) {
        return value instanceof String
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>
                || isImmutableNumber(value)
                || (value instanceof Record record && isLeafRecord(record));
    }

    private static boolean isImmutableNumber(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof Float || value instanceof Double
                || value instanceof BigInteger || value instanceof BigDecimal;
    }

    private static boolean isLeafRecord(Record record) {
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Method accessor = component.getAccessor();
            Object part;
            try {
                accessor.setAccessible(true);
                part = accessor.invoke(record);
            } catch (IllegalAccessException | InvocationTargetException | InaccessibleObjectException | SecurityException e) {
                return false;
            }
            if (part == null || !isLeaf(part)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Value equality as the store sees it: numbers compare numerically across
     * boxed types, NaN equals nothing, everything else uses {@link Object#equals}.
     */
    public static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isNaN(x) || isNaN(y)) {
                return false;
            }
            return compareNumbers(x, y) == 0;
        }
        return Objects.equals(a, b);
    }

    public static boolean isNaN(Number n) {
        return (n instanceof Double d && d.isNaN()) || (n instanceof Float f && f.isNaN());
    }

    /** Numeric comparison; callers must rule out NaN first. */
    public static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            if (a instanceof BigInteger || b instanceof BigInteger) {
                return toBigInteger(a).compareTo(toBigInteger(b));
            }
            return Long.compare(a.longValue(), b.longValue());
        }
        if (isInfinite(a) || isInfinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    /** Short type description used in error messages. */
    public static String typeName(Object value) {
        if (value == null) return "undefined";
        if (value instanceof StateList) return "sequence";
        if (value instanceof StateMap) return "mapping";
        if (value instanceof Number) return "number";
        if (value instanceof String || value instanceof Character) return "string";
        if (value instanceof Boolean) return "boolean";
        return value.getClass().getSimpleName();
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger;
    }

    private static boolean isInfinite(Number n) {
        return (n instanceof Double d && d.isInfinite()) || (n instanceof Float f && f.isInfinite());
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger big ? big : BigInteger.valueOf(n.longValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal decimal) return decimal;
        if (n instanceof BigInteger big) return new BigDecimal(big);
        if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
        return BigDecimal.valueOf(n.doubleValue());
    }
}
