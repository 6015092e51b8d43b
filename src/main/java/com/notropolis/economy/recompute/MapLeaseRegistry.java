package com.notropolis.economy.recompute;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.error.ConflictException;
import com.notropolis.economy.error.InternalException;

/**
 * One exclusive lease per map identifier. Maps never share a lock, so passes on
 * different maps run side by side.
 */
public class MapLeaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(MapLeaseRegistry.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public MapLeaseRegistry(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    /**
     * Waits up to the configured timeout for the map's lease.
     *
     * @throws ConflictException if another pass still holds it
     * @throws InternalException if the waiting thread is interrupted
     */
    public Lease acquire(String mapId) {
        ReentrantLock lock = locks.computeIfAbsent(mapId, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalException("Interrupted while waiting for the lease of map " + mapId, e);
        }
        if (!acquired) {
            log.warn("Lease of map {} still held after {} ms", mapId, waitTimeout.toMillis());
            throw new ConflictException("A recompute pass is already running on map " + mapId);
        }
        log.debug("Acquired lease of map {}", mapId);
        return new Lease(mapId, lock);
    }

    public boolean isHeld(String mapId) {
        ReentrantLock lock = locks.get(mapId);
        return lock != null && lock.isLocked();
    }

    /**
     * Held lease; closing it releases the map.
     */
    public static final class Lease implements AutoCloseable {
        private final String mapId;
        private final ReentrantLock lock;

        private Lease(String mapId, ReentrantLock lock) {
            this.mapId = mapId;
            this.lock = lock;
        }

        public String getMapId() {
            return mapId;
        }

        @Override
        public void close() {
            lock.unlock();
            log.debug("Released lease of map {}", mapId);
        }
    }
}
