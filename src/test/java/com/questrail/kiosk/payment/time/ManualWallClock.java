package com.questrail.kiosk.payment.time;

import com.questrail.kiosk.payment.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wall clock for tests: fixed until moved.
 */
public final class ManualWallClock implements WallClock {

    private final AtomicReference<Instant> now;

    public ManualWallClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    @Override
    public Instant now() {
        return now.get();
    }

    public void set(Instant instant) {
        now.set(instant);
    }

    public void advance(Duration delta) {
        now.updateAndGet(t -> t.plus(delta));
    }
}
