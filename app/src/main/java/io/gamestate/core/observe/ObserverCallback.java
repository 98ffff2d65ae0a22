package io.gamestate.core.observe;

/** Receives the new and old value at a changed path; either is null when absent. */
@FunctionalInterface
public interface ObserverCallback {
    void onChange(Object newValue, Object oldValue, ObserverContext context);
}
