package com.questrail.kiosk.payment.internal.engine;

import com.questrail.kiosk.payment.config.RuntimeConfiguration;
import com.questrail.kiosk.payment.internal.time.WallClock;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * EngineContext
 * -----------------------------------------------------------------------------
 * State shared by the calls served by one engine: the active
 * {@link RuntimeConfiguration} and the heartbeat.
 *
 * <p>A configuration is replaced wholesale and only by a successful
 * {@code Init}; readers always see either the previous or the new value.</p>
 */
final class EngineContext
{
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Heartbeat heartbeat;

    private RuntimeConfiguration configuration;

    EngineContext(WallClock clock) {
        this.heartbeat = new Heartbeat(clock);
    }

    Optional<RuntimeConfiguration> configuration() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(configuration);
        } finally {
            lock.readLock().unlock();
        }
    }

    void activate(RuntimeConfiguration newConfiguration) {
        Objects.requireNonNull(newConfiguration, "newConfiguration");
        lock.writeLock().lock();
        try {
            configuration = newConfiguration;
            heartbeat.start();
        } finally {
            lock.writeLock().unlock();
        }
    }

    void deactivate() {
        lock.writeLock().lock();
        try {
            heartbeat.stop();
        } finally {
            lock.writeLock().unlock();
        }
    }

    boolean alive() {
        return heartbeat.alive();
    }

    Optional<Instant> aliveSince() {
        return heartbeat.aliveSince();
    }
}
