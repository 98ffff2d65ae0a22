package io.gamestate.core.protocol;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A named, path-addressed state change. Built only through {@link Mutations};
 * {@link #apply} is pure and either returns a new tree or throws.
 */
public final class Mutation {

    private final MutationType type;
    private final String path;
    private final String description;
    private final UnaryOperator<Object> fn;

    Mutation(MutationType type, String path, String description, UnaryOperator<Object> fn) {
        this.type = Objects.requireNonNull(type, "type");
        this.path = Objects.requireNonNull(path, "path");
        this.description = Objects.requireNonNull(description, "description");
        this.fn = Objects.requireNonNull(fn, "fn");
    }

    public MutationType type() { return type; }
    public String path() { return path; }
    public String description() { return description; }

    public Object apply(Object state) {
        return fn.apply(state);
    }

    @Override
    public String toString() {
        return type + "(" + path + "): " + description;
    }
}
