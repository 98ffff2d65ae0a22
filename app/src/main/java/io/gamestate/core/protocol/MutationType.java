package io.gamestate.core.protocol;

public enum MutationType {
    SET,
    UPDATE,
    PUSH,
    REMOVE
}
