package io.gamestate.core.query;

import java.util.Map;

/** 2-D point. Mapping nodes with numeric {@code x} and {@code y} convert to it. */
public record Vec2(double x, double y) {

    /** Point view of a state value, or null if it is not point-shaped. */
    public static Vec2 from(Object value) {
        if (value instanceof Vec2 point) {
            return point;
        }
        if (value instanceof Map<?, ?> map) {
            if (map.get("x") instanceof Number x && map.get("y") instanceof Number y) {
                return new Vec2(x.doubleValue(), y.doubleValue());
            }
        }
        return null;
    }

    public double distanceSquared(Vec2 other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return dx * dx + dy * dy;
    }
}
