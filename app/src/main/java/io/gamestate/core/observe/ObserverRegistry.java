package io.gamestate.core.observe;

import io.gamestate.core.protocol.Diff;
import io.gamestate.core.protocol.DiffEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Path-pattern subscriptions owned by one store. Not thread-safe; callers
 * serialize access the same way they serialize dispatch.
 */
public final class ObserverRegistry {
    private static final Logger LOG = Logger.getLogger(ObserverRegistry.class.getName());

    private final List<Subscription> subscriptions = new ArrayList<>();

    public Unsubscribe observe(String pattern, ObserverCallback callback) {
        Objects.requireNonNull(callback, "callback");
        Subscription sub = new Subscription(PathPattern.compile(pattern), callback);
        subscriptions.add(sub);
        return () -> {
            if (sub.active) {
                sub.active = false;
                subscriptions.remove(sub);
            }
        };
    }

    /**
     * Delivers every entry of {@code diff} to the matching subscriptions, entry by
     * entry and in registration order. A callback that throws is logged and skipped.
     *
     * @return number of callbacks that threw
     */
    public int notify(Diff diff) {
        int failures = 0;
        for (DiffEntry entry : diff.entries()) {
            if (subscriptions.isEmpty()) {
                break;
            }
            ObserverContext context = new ObserverContext(entry.path(), diff);
            // snapshot: callbacks may (un)subscribe while we iterate
            for (Subscription sub : List.copyOf(subscriptions)) {
                if (!sub.active || !sub.pattern.matches(entry.path())) {
                    continue;
                }
                try {
                    sub.callback.onChange(entry.to(), entry.from(), context);
                } catch (RuntimeException e) {
                    failures++;
                    LOG.log(Level.WARNING, "Observer for \"" + sub.pattern + "\" failed on " + entry.path(), e);
                }
            }
        }
        return failures;
    }

    public void clear() {
        for (Subscription sub : subscriptions) {
            sub.active = false;
        }
        subscriptions.clear();
    }

    public int size() { return subscriptions.size(); }

    private static final class Subscription {
        final PathPattern pattern;
        final ObserverCallback callback;
        boolean active = true;

        Subscription(PathPattern pattern, ObserverCallback callback) {
            this.pattern = pattern;
            this.callback = callback;
        }
    }
}
