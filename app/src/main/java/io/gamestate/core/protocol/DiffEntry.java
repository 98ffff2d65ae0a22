package io.gamestate.core.protocol;

/**
 * One leaf-level change. {@code from} is null when the value was added,
 * {@code to} is null when it was removed.
 */
public record DiffEntry(String path, Object from, Object to) {
}
