package io.gamestate.core.observe;

import io.gamestate.core.protocol.Diff;

/**
 * @param path concrete path of the change, wildcards already resolved
 * @param diff full diff of the transaction being delivered
 */
public record ObserverContext(String path, Diff diff) {
}
