package io.gamestate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/** Dispatch counters and timings for one store. */
public final class StoreMetrics {

    private final MeterRegistry registry;
    private final Counter committed;
    private final Counter rejected;
    private final Counter observerFailures;
    private final Timer dispatchTime;
    private final DistributionSummary diffEntries;

    public StoreMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.committed = Counter.builder("store.transactions.committed")
                .description("Dispatches that committed")
                .register(registry);
        this.rejected = Counter.builder("store.transactions.rejected")
                .description("Dispatches rolled back because a mutation failed")
                .register(registry);
        this.observerFailures = Counter.builder("store.observer.failures")
                .description("Observer callbacks that threw")
                .register(registry);
        this.dispatchTime = registry.timer("store.dispatch.time");
        this.diffEntries = DistributionSummary.builder("store.diff.entries")
                .baseUnit("entries")
                .description("Diff size of committed dispatches")
                .register(registry);
    }

    public <T> T recordDispatch(Supplier<T> dispatchLogic) {
        return dispatchTime.record(dispatchLogic);
    }

    public void committed(int diffSize) {
        committed.increment();
        diffEntries.record(diffSize);
    }

    public void rejected() {
        rejected.increment();
    }

    public void observerFailures(int count) {
        if (count > 0) {
            observerFailures.increment(count);
        }
    }

    public double committedCount() { return committed.count(); }
    public double rejectedCount() { return rejected.count(); }
    public double observerFailureCount() { return observerFailures.count(); }

    public String scrape() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
