package net.jobclaim.core.support;

import net.jobclaim.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

public final class MutableClock implements Clock {
    private final AtomicReference<Instant> now;

    public MutableClock(Instant start) { this.now = new AtomicReference<>(start); }

    @Override public Instant now() { return now.get(); }

    public void set(Instant t) { now.set(t); }

    public Instant advance(Duration d) { return now.updateAndGet(t -> t.plus(d)); }
}
