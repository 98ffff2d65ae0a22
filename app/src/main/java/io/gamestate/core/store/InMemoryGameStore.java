package io.gamestate.core.store;

import io.gamestate.core.metrics.StoreMetrics;
import io.gamestate.core.observe.ObserverCallback;
import io.gamestate.core.observe.ObserverRegistry;
import io.gamestate.core.observe.Unsubscribe;
import io.gamestate.core.protocol.Mutation;
import io.gamestate.core.protocol.TransactionResult;
import io.gamestate.core.query.Queries;
import io.gamestate.core.state.Transactions;
import io.gamestate.core.tree.StateTrees;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Default {@link GameStore}: one live tree, one observer registry and one
 * append-only history list per instance.
 *
 * <p>Observers may dispatch on the same store. The nested dispatch runs to
 * completion inside the callback, so its history record lands after the outer
 * one and its observers fire before the outer notification loop resumes.
 */
public final class InMemoryGameStore implements GameStore {
    private static final Logger LOG = Logger.getLogger(InMemoryGameStore.class.getName());

    private final ObserverRegistry observers = new ObserverRegistry();
    private final List<TransactionRecord> history = new ArrayList<>();
    private final ComponentIndex componentIndex = new ComponentIndex();
    private final StoreConfig config;
    private final StoreMetrics metrics;

    private Object state;

    public InMemoryGameStore(Object initialState, StoreConfig config) {
        Objects.requireNonNull(initialState, "initialState");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = new StoreMetrics(config.meterRegistry);
        this.state = StateTrees.freeze(initialState);
    }

    @Override
    public Object getState() {
        return state;
    }

    @Override
    public TransactionResult dispatch(List<Mutation> mutations) {
        Objects.requireNonNull(mutations, "mutations");
        Object oldState = state;
        TransactionResult result = metrics.recordDispatch(() -> Transactions.transaction(oldState, mutations));

        if (!result.valid()) {
            metrics.rejected();
            if (config.logRejections) {
                LOG.fine("Dispatch rejected: " + result.error().message()
                        + " [" + result.error().context().action() + "]");
            }
            return result;
        }

        state = result.state();
        history.add(new TransactionRecord(config.clock.millis(), mutations, result.diff()));
        metrics.committed(result.diff().size());
        componentIndex.onCommit(result.diff(), state);

        metrics.observerFailures(observers.notify(result.diff()));
        return result;
    }

    @Override
    public Unsubscribe observe(String pattern, ObserverCallback callback) {
        return observers.observe(pattern, callback);
    }

    @Override
    public List<Object> query(String path) {
        return Queries.query(state, path);
    }

    @Override
    public List<Object> query(String path, Predicate<Object> filter) {
        return Queries.query(state, path, filter);
    }

    @Override
    public List<Object> query(String path, Map<String, ?> fieldFilter) {
        return Queries.query(state, path, fieldFilter);
    }

    @Override
    public Object get(String path) {
        return Queries.get(state, path);
    }

    @Override
    public boolean has(String path) {
        return Queries.has(state, path);
    }

    @Override
    public boolean has(String path, Predicate<Object> predicate) {
        return Queries.has(state, path, predicate);
    }

    @Override
    public void replaceState(Object newState) {
        Objects.requireNonNull(newState, "newState");
        state = StateTrees.freeze(newState);
        componentIndex.rebuild(state);
        LOG.fine("State replaced (history size " + history.size() + " unchanged)");
    }

    @Override
    public List<TransactionRecord> getHistory() {
        return List.copyOf(history);
    }

    @Override
    public void enableComponentIndex(String collectionPath) {
        Objects.requireNonNull(collectionPath, "collectionPath");
        componentIndex.enable(collectionPath, state);
    }

    @Override
    public Set<String> getEntitiesWithComponent(String component) {
        return componentIndex.entitiesWith(component);
    }

    public StoreMetrics metrics() {
        return metrics;
    }

    /** Subscription count; observers are never expired implicitly. */
    public int observerCount() {
        return observers.size();
    }
}
