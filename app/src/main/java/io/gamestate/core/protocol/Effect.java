package io.gamestate.core.protocol;

import java.util.Map;

/** Event produced by a state change. Reserved: transactions currently emit none. */
public record Effect(String type, String source, Map<String, Object> data) {

    public Effect {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
