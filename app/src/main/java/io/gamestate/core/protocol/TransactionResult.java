package io.gamestate.core.protocol;

import java.util.List;

/**
 * Outcome of applying a batch of mutations. When {@link #valid()} is false,
 * {@link #state()} is the untouched input state, the diff is empty and
 * {@link #error()} explains the failure.
 */
public final class TransactionResult {

    private final Object state;
    private final Diff diff;
    private final List<Effect> effects;
    private final boolean valid;
    private final StoreError error;

    private TransactionResult(Object state, Diff diff, List<Effect> effects, boolean valid, StoreError error) {
        this.state = state;
        this.diff = diff;
        this.effects = effects;
        this.valid = valid;
        this.error = error;
    }

    public static TransactionResult committed(Object state, Diff diff) {
        return new TransactionResult(state, diff, List.of(), true, null);
    }

    public static TransactionResult failed(Object originalState, StoreError error) {
        return new TransactionResult(originalState, Diff.empty(), List.of(), false, error);
    }

    public Object state() { return state; }
    public Diff diff() { return diff; }
    public List<Effect> effects() { return effects; }
    public boolean valid() { return valid; }

    /** Null when the transaction succeeded. */
    public StoreError error() { return error; }

    @Override
    public String toString() {
        return valid ? "OK(" + diff.size() + " changes)" : String.valueOf(error);
    }
}
