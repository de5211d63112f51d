package com.neohoods.bridge.services.matrix;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Per-user {@code /sync} continuation tokens.
 */
@Component
@RequiredArgsConstructor
public class SyncPositionStore {

    private final Map<String, Position> positions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    /**
     * @return the stored token, empty when the user must sync from the start
     */
    public String get(String matrixId) {
        lock.readLock().lock();
        try {
            Position position = positions.get(key(matrixId));
            return position == null ? "" : position.token;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Instant> lastObservedAt(String matrixId) {
        lock.readLock().lock();
        try {
            Position position = positions.get(key(matrixId));
            return position == null ? Optional.empty() : Optional.of(position.observedAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void store(String matrixId, String token) {
        Position position = new Position(token, clock.instant());
        lock.writeLock().lock();
        try {
            positions.put(key(matrixId), position);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear(String matrixId) {
        lock.writeLock().lock();
        try {
            positions.remove(key(matrixId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static String key(String matrixId) {
        return matrixId == null ? "" : matrixId.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Position {
        private final String token;
        private final Instant observedAt;

        private Position(String token, Instant observedAt) {
            this.token = token;
            this.observedAt = observedAt;
        }
    }
}
