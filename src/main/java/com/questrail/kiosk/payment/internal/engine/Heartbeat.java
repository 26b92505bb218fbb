package com.questrail.kiosk.payment.internal.engine;

import com.questrail.kiosk.payment.internal.time.WallClock;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Liveness flag of the engine: set by a successful {@code Init}, cleared by
 * {@code Shutdown}. Reading it never blocks.
 */
final class Heartbeat
{
    private final WallClock clock;
    private final AtomicReference<Instant> aliveSince = new AtomicReference<>();

    Heartbeat(WallClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    void start() {
        aliveSince.set(clock.now());
    }

    void stop() {
        aliveSince.set(null);
    }

    boolean alive() {
        return aliveSince.get() != null;
    }

    Optional<Instant> aliveSince() {
        return Optional.ofNullable(aliveSince.get());
    }
}
