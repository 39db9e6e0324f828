package com.ryuqq.packsync.testkit.contract;

import com.ryuqq.packsync.core.model.ServerState;
import com.ryuqq.packsync.core.model.WatchState;
import com.ryuqq.packsync.core.spi.StateStore;
import com.ryuqq.packsync.core.spi.StateStoreException;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of StateStore for testing purposes.
 *
 * <p>Follows the same locking discipline as the file-backed store: a single read-write lock
 * guards the server map and the last poll time. {@link #save()} only records that it was called.</p>
 *
 * <p><strong>Test Hooks:</strong></p>
 * <ul>
 *   <li>{@link #saveCount()}: number of successful saves</li>
 *   <li>{@link #failSaves(boolean)}: make subsequent saves throw {@link StateStoreException}</li>
 *   <li>{@link #lastSaved()}: snapshot taken by the most recent successful save</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ServerState> servers = new HashMap<>();
    private final AtomicInteger saveCount = new AtomicInteger();
    private final AtomicBoolean failSaves = new AtomicBoolean(false);
    private volatile WatchState lastSaved = WatchState.empty();
    private Instant lastPoll;

    /**
     * Creates an empty store.
     */
    public InMemoryStateStore() {
    }

    /**
     * Creates a store pre-populated with the given state.
     *
     * @param initial initial state
     */
    public InMemoryStateStore(WatchState initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        this.lastPoll = initial.lastPoll();
        this.servers.putAll(initial.servers());
    }

    @Override
    public boolean needsGeneration(
        String namespace,
        String name,
        String version,
        String packageType,
        String transportType,
        Instant updatedAt
    ) {
        String key = ServerState.keyOf(namespace, name, version, packageType, transportType);
        lock.readLock().lock();
        try {
            ServerState existing = servers.get(key);
            if (existing == null) {
                return true;
            }
            return existing.generatedAt() == null || (updatedAt != null && updatedAt.isAfter(existing.generatedAt()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setServer(ServerState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        lock.writeLock().lock();
        try {
            servers.put(state.key(), state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ServerState> getServer(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(servers.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void updateLastPoll(Instant lastPoll) {
        lock.writeLock().lock();
        try {
            this.lastPoll = lastPoll;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Instant> getLastPoll() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lastPoll);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int pruneOlderThan(Duration maxAge, Instant now) {
        if (maxAge == null || now == null) {
            throw new IllegalArgumentException("maxAge and now cannot be null");
        }
        Instant cutoff = now.minus(maxAge);
        lock.writeLock().lock();
        try {
            int before = servers.size();
            servers.values().removeIf(state -> state.updatedAt() == null || state.updatedAt().isBefore(cutoff));
            return before - servers.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return servers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public WatchState snapshot() {
        lock.readLock().lock();
        try {
            return new WatchState(lastPoll, servers);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save() {
        if (failSaves.get()) {
            throw new StateStoreException("simulated save failure", null);
        }
        lastSaved = snapshot();
        saveCount.incrementAndGet();
    }

    /**
     * Returns the number of successful saves.
     *
     * @return save count
     */
    public int saveCount() {
        return saveCount.get();
    }

    /**
     * Returns the state captured by the most recent successful save.
     *
     * @return last saved snapshot (empty if never saved)
     */
    public WatchState lastSaved() {
        return lastSaved;
    }

    /**
     * Makes subsequent saves fail (or succeed again).
     *
     * @param fail whether saves should throw
     */
    public void failSaves(boolean fail) {
        failSaves.set(fail);
    }

    /**
     * Clears all state (used between tests).
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            servers.clear();
            lastPoll = null;
        } finally {
            lock.writeLock().unlock();
        }
        saveCount.set(0);
        lastSaved = WatchState.empty();
    }
}
