package io.gamestate.core.state;

import io.gamestate.core.protocol.Diff;
import io.gamestate.core.protocol.ErrorContext;
import io.gamestate.core.protocol.Mutation;
import io.gamestate.core.protocol.StoreError;
import io.gamestate.core.protocol.TransactionResult;
import io.gamestate.core.tree.StateTrees;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * All-or-nothing application of a mutation batch. Pure: no I/O, no retries,
 * the input state is never modified, so it is safe for what-if evaluation.
 */
public final class Transactions {

    static final String SUGGESTION = "Check that all paths exist and values are of expected types";

    private Transactions() {}

    /**
     * Folds {@code mutations} over {@code state} in order. Plain maps and lists in
     * {@code state} are frozen first; the failed result still carries the original argument.
     */
    public static TransactionResult transaction(Object state, List<Mutation> mutations) {
        Objects.requireNonNull(mutations, "mutations");
        Object start = state == null ? null : StateTrees.freeze(state);
        Object current = start;
        for (int i = 0; i < mutations.size(); i++) {
            Mutation mutation = mutations.get(i);
            try {
                current = mutation.apply(current);
            } catch (RuntimeException e) {
                return TransactionResult.failed(state, failure(mutations, i, e));
            }
        }
        Diff diff = DiffEngine.computeDiff(start, current);
        return TransactionResult.committed(current, diff);
    }

    public static Diff computeDiff(Object before, Object after) {
        return DiffEngine.computeDiff(before, after);
    }

    private static StoreError failure(List<Mutation> mutations, int failedIndex, RuntimeException e) {
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        StringJoiner action = new StringJoiner("; ");
        for (int i = 0; i <= failedIndex; i++) {
            action.add(mutations.get(i).description());
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("failedIndex", failedIndex);
        detail.put("failedMutation", mutations.get(failedIndex).description());
        return StoreError.of(StoreError.TRANSACTION_FAILED, "Transaction failed: " + reason,
                new ErrorContext(action.toString(), reason, detail, SUGGESTION));
    }
}
