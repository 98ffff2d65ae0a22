package io.gamestate.core.store;

import io.gamestate.core.observe.ObserverCallback;
import io.gamestate.core.observe.Unsubscribe;
import io.gamestate.core.protocol.Mutation;
import io.gamestate.core.protocol.TransactionResult;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Single source of truth for game state. The tree is only ever replaced
 * wholesale: by a committed {@link #dispatch} or by {@link #replaceState}.
 *
 * <p>Everything runs synchronously on the calling thread and nothing is locked;
 * concurrent callers must serialize {@code dispatch} and {@code replaceState}.
 */
public interface GameStore {

    static GameStore createStore(Object initialState) {
        return new InMemoryGameStore(initialState, StoreConfig.defaults());
    }

    static GameStore createStore(Object initialState, StoreConfig config) {
        return new InMemoryGameStore(initialState, config);
    }

    /** Current tree. Deeply read-only: every mutator throws UnsupportedOperationException. */
    Object getState();

    /**
     * Applies {@code mutations} atomically. On success the new tree is swapped in,
     * a history record is appended and observers are notified, in that order.
     * On failure nothing changes. Never throws for a failing mutation.
     */
    TransactionResult dispatch(List<Mutation> mutations);

    default TransactionResult dispatch(Mutation... mutations) {
        return dispatch(List.of(mutations));
    }

    /** Subscribes to an exact or {@code *} pattern; fires synchronously inside dispatch. */
    Unsubscribe observe(String pattern, ObserverCallback callback);

    List<Object> query(String path);
    List<Object> query(String path, Predicate<Object> filter);
    List<Object> query(String path, Map<String, ?> fieldFilter);

    /** Value at {@code path} or null; never throws for a missing path. */
    Object get(String path);

    boolean has(String path);
    boolean has(String path, Predicate<Object> predicate);

    /** Swaps the tree silently: no history record, no observer calls. */
    void replaceState(Object newState);

    /** Committed transactions in dispatch order. */
    List<TransactionRecord> getHistory();

    /** Indexes the entity mapping at {@code collectionPath} by component (property) name. */
    void enableComponentIndex(String collectionPath);

    /** Ids of indexed entities that have {@code component}; empty when indexing is off. */
    Set<String> getEntitiesWithComponent(String component);
}
