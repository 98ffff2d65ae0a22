package io.gamestate.core.query;

import io.gamestate.core.tree.Values;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * Predicate factories for {@link Queries#query}. Ordering filters are false for
 * anything that is not a number (and for NaN); equality uses {@link Values#sameValue}.
 */
public final class Filters {

    private Filters() {}

    public static Predicate<Object> lt(Number bound) { return compare(bound, c -> c < 0); }
    public static Predicate<Object> gt(Number bound) { return compare(bound, c -> c > 0); }
    public static Predicate<Object> lte(Number bound) { return compare(bound, c -> c <= 0); }
    public static Predicate<Object> gte(Number bound) { return compare(bound, c -> c >= 0); }

    public static Predicate<Object> eq(Object expected) {
        return value -> Values.sameValue(value, expected);
    }

    public static Predicate<Object> neq(Object expected) {
        return value -> !Values.sameValue(value, expected);
    }

    public static Predicate<Object> oneOf(Object... options) {
        List<Object> copy = Arrays.asList(options.clone());
        return value -> {
            for (Object option : copy) {
                if (Values.sameValue(value, option)) return true;
            }
            return false;
        };
    }

    /** Points (Vec2 or {x, y} mappings) at Euclidean distance {@code <= maxDistance} from center. */
    public static Predicate<Object> within(Vec2 center, double maxDistance) {
        Objects.requireNonNull(center, "center");
        double limit = maxDistance * maxDistance;
        return value -> {
            Vec2 point = Vec2.from(value);
            return point != null && point.distanceSquared(center) <= limit;
        };
    }

    /** True when every predicate holds; true for no predicates. */
    @SafeVarargs
    public static Predicate<Object> allOf(Predicate<Object>... predicates) {
        List<Predicate<Object>> copy = List.of(predicates);
        return value -> {
            for (Predicate<Object> p : copy) {
                if (!p.test(value)) return false;
            }
            return true;
        };
    }

    /** True when at least one predicate holds; false for no predicates. */
    @SafeVarargs
    public static Predicate<Object> anyOf(Predicate<Object>... predicates) {
        List<Predicate<Object>> copy = List.of(predicates);
        return value -> {
            for (Predicate<Object> p : copy) {
                if (p.test(value)) return true;
            }
            return false;
        };
    }

    public static Predicate<Object> not(Predicate<Object> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return value -> !predicate.test(value);
    }

    private static Predicate<Object> compare(Number bound, IntPredicate test) {
        Objects.requireNonNull(bound, "bound");
        return value -> {
            if (!(value instanceof Number number) || Values.isNaN(number) || Values.isNaN(bound)) {
                return false;
            }
            return test.test(Values.compareNumbers(number, bound));
        };
    }
}
