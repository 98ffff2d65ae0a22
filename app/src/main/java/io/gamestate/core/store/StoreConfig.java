package io.gamestate.core.store;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.util.Objects;

/** Settings for a single store instance. */
public final class StoreConfig {
    public final Clock clock;
    public final MeterRegistry meterRegistry;
    public final boolean logRejections;

    public StoreConfig(Clock clock, MeterRegistry meterRegistry, boolean logRejections) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.logRejections = logRejections;
    }

    /** System UTC clock, a private SimpleMeterRegistry, rejections logged at FINE. */
    public static StoreConfig defaults() {
        return new StoreConfig(Clock.systemUTC(), new SimpleMeterRegistry(), true);
    }

    public StoreConfig withClock(Clock clock) {
        return new StoreConfig(clock, this.meterRegistry, this.logRejections);
    }

    public StoreConfig withMeterRegistry(MeterRegistry meterRegistry) {
        return new StoreConfig(this.clock, meterRegistry, this.logRejections);
    }

    public StoreConfig withLogRejections(boolean logRejections) {
        return new StoreConfig(this.clock, this.meterRegistry, logRejections);
    }
}
