package io.gamestate.core.observe;

/** Handle returned by {@code observe}. Calling it again is a no-op. */
@FunctionalInterface
public interface Unsubscribe {
    void unsubscribe();
}
