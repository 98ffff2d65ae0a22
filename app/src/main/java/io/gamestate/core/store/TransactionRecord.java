package io.gamestate.core.store;

import io.gamestate.core.protocol.Diff;
import io.gamestate.core.protocol.Mutation;

import java.util.List;

/** History entry for one committed dispatch. */
public record TransactionRecord(long timestamp, List<Mutation> mutations, Diff diff) {

    public TransactionRecord {
        mutations = List.copyOf(mutations);
    }
}
